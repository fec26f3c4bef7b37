package com.libragraph.finder.formats.api;

import java.io.IOException;

/**
 * A member decompressed to more bytes than the caller allowed. Reading stops at the limit,
 * so the member's real size is unknown beyond it.
 */
public class MemberTooLargeException extends IOException {

    private final String memberName;
    private final long limit;

    public MemberTooLargeException(String memberName, long limit) {
        super("Member " + memberName + " exceeds " + limit + " bytes");
        this.memberName = memberName;
        this.limit = limit;
    }

    public String memberName() {
        return memberName;
    }

    public long limit() {
        return limit;
    }
}

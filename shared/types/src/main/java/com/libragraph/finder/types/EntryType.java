package com.libragraph.finder.types;

/**
 * Kind of container member. Symlinks are listed but read as plain members holding the link target.
 */
public enum EntryType {
    FILE,
    DIRECTORY,
    SYMLINK
}

package com.my.integrity.domain.model;

/**
 * 파일 트리 항목 종류. {@code tag}는 다이제스트에 기록되는 1바이트 식별자다.
 */
public enum EntryType {
    DIRECTORY('d'),
    FILE('f'),
    SYMLINK('l'),
    HARDLINK('h'),
    OTHER('o');

    private final char tag;

    EntryType(char tag) {
        this.tag = tag;
    }

    public byte tag() {
        return (byte) tag;
    }
}

package com.botsession.channel;

/**
 * Rich-media kinds and their platform file type codes.
 */
public enum MediaType {
    IMAGE(1),
    VIDEO(2),
    VOICE(3);

    private final int fileType;

    MediaType(int fileType) {
        this.fileType = fileType;
    }

    public int fileType() {
        return fileType;
    }
}

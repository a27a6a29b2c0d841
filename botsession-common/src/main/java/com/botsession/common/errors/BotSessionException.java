package com.botsession.common.errors;

/**
 * Base type of every error raised by the bot session library.
 * <p>
 * Each error carries a numeric code; the rendered message puts the code on
 * the first line and the detail on the second.
 */
public class BotSessionException extends RuntimeException {

    private final int code;
    private final String detail;

    public BotSessionException(String detail, int code) {
        this(detail, code, null);
    }

    public BotSessionException(String detail, int code, Throwable cause) {
        super(render(detail, code), cause);
        this.code = code;
        this.detail = detail;
    }

    public int getCode() {
        return code;
    }

    /** The message without the code line. */
    public String getDetail() {
        return detail;
    }

    private static String render(String detail, int code) {
        return "error code: " + code + "\n" + detail;
    }
}

package com.astradesk.reviewtracker.web.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * One raw status change as posted by a caller. The timestamp is kept textual
 * here and normalized when the request is mapped.
 */
public class TransitionPayload {

    @NotBlank
    private String timestamp;

    private String fromStatus;

    private String toStatus;

    private String author;

    public TransitionPayload() {
    }

    public TransitionPayload(String timestamp, String fromStatus, String toStatus, String author) {
        this.timestamp = timestamp;
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
        this.author = author;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public String getFromStatus() {
        return fromStatus;
    }

    public void setFromStatus(String fromStatus) {
        this.fromStatus = fromStatus;
    }

    public String getToStatus() {
        return toStatus;
    }

    public void setToStatus(String toStatus) {
        this.toStatus = toStatus;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }
}

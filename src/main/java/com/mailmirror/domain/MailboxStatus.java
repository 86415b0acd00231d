package com.mailmirror.domain;

/**
 * Result of a SELECT/EXAMINE
 */
public record MailboxStatus(String name, int messages, boolean readOnly) {
}

package com.mailmirror.domain;

import jakarta.mail.Flags;

import java.util.Date;

/**
 * A message read from the source mailbox.
 *
 * @param uid          source UID (unsigned 32-bit)
 * @param flags        flags at fetch time
 * @param internalDate INTERNALDATE at the source
 * @param body         raw RFC 5322 message (BODY[])
 */
public record MirroredMessage(long uid, Flags flags, Date internalDate, byte[] body) {

    public boolean isDeleted() {
        return flags.contains(Flags.Flag.DELETED);
    }

    /**
     * Flags to set on the target copy: everything except \Recent and \Seen
     */
    public Flags forwardableFlags() {
        Flags forwarded = new Flags(flags);
        forwarded.remove(Flags.Flag.RECENT);
        forwarded.remove(Flags.Flag.SEEN);
        return forwarded;
    }

    public int size() {
        return body.length;
    }
}

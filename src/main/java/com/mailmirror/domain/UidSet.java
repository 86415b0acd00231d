package com.mailmirror.domain;

import java.util.Collections;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Set of message UIDs, rendered as a compressed IMAP sequence set (e.g., "1:3,7,9:10").
 * Insertion order does not matter.
 */
public class UidSet {

    public static final long MAX_UID = 0xFFFFFFFFL;

    private final NavigableSet<Long> uids = new TreeSet<>();

    public UidSet add(long uid) {
        if (uid < 1 || uid > MAX_UID) {
            throw new IllegalArgumentException("UID out of range: " + uid);
        }
        uids.add(uid);
        return this;
    }

    public boolean isEmpty() {
        return uids.isEmpty();
    }

    public int size() {
        return uids.size();
    }

    public boolean contains(long uid) {
        return uids.contains(uid);
    }

    public NavigableSet<Long> values() {
        return Collections.unmodifiableNavigableSet(uids);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        Long start = null;
        Long prev = null;
        for (Long uid : uids) {
            if (prev != null && uid == prev + 1) {
                prev = uid;
                continue;
            }
            appendRange(sb, start, prev);
            start = uid;
            prev = uid;
        }
        appendRange(sb, start, prev);
        return sb.toString();
    }

    private static void appendRange(StringBuilder sb, Long start, Long end) {
        if (start == null) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(',');
        }
        sb.append(start);
        if (!start.equals(end)) {
            sb.append(':').append(end);
        }
    }
}

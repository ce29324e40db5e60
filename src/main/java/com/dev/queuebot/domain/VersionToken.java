package com.dev.queuebot.domain;

import java.util.Objects;

/**
 * Opaque optimistic-concurrency token handed out by remote storage. The textual form belongs to the
 * storage adapter that produced it; everything else only passes it back unchanged on the next write.
 */
public final class VersionToken {

    private final String value;

    private VersionToken(String value) {
        this.value = value;
    }

    public static VersionToken of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Version token must not be blank");
        }
        return new VersionToken(value);
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VersionToken other)) {
            return false;
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}

package com.dev.queuebot.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * A queue change not yet confirmed by remote storage. Replaying it on a queue that already holds it
 * is a no-op.
 */
public interface QueueMutation {

    List<SongEntry> applyTo(List<SongEntry> songs);

    record Append(SongEntry entry) implements QueueMutation {

        @Override
        public List<SongEntry> applyTo(List<SongEntry> songs) {
            List<SongEntry> next = new ArrayList<>(songs);
            if (next.stream().noneMatch(entry::hasSameId)) {
                next.add(entry);
            }
            return next;
        }
    }

    record RemoveEntry(SongEntry entry) implements QueueMutation {

        @Override
        public List<SongEntry> applyTo(List<SongEntry> songs) {
            List<SongEntry> next = new ArrayList<>(songs);
            for (int i = 0; i < next.size(); i++) {
                if (entry.isSameSong(next.get(i))) {
                    next.remove(i);
                    break;
                }
            }
            return next;
        }
    }
}

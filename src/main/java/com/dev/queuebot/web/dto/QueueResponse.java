package com.dev.queuebot.web.dto;

import com.dev.queuebot.domain.SongEntry;

import java.util.ArrayList;
import java.util.List;

public record QueueResponse(
        List<QueueItemView> items
) {

    public static QueueResponse of(List<SongEntry> songs) {
        List<QueueItemView> items = new ArrayList<>(songs.size());
        for (int i = 0; i < songs.size(); i++) {
            SongEntry song = songs.get(i);
            items.add(new QueueItemView(
                    song.getId(),
                    song.getTitle(),
                    song.getUrl(),
                    song.getDurationSeconds(),
                    i,
                    song.getRequestedBy(),
                    song.getRequestedByUserId()
            ));
        }
        return new QueueResponse(items);
    }
}

package com.starscape.capture.features.video.domain;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.lifecycle.MembershipSet;
import com.starscape.capture.features.video.domain.events.PlaylistCreated;
import com.starscape.capture.features.video.domain.events.PlaylistSynced;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public class Playlist extends AggregateRoot<PlaylistId> {

    public static final String AGGREGATE_TYPE = "playlist";

    private final PlaylistId id;
    private String title;
    private String description;
    private final ChannelId channelId;
    private boolean publicPlaylist;
    private final Instant createdAt;
    private Instant lastSyncedAt;
    private final MembershipSet<VideoId> videos;

    private Playlist(PlaylistId id, String title, String description, ChannelId channelId, boolean publicPlaylist,
                     Instant createdAt, MembershipSet<VideoId> videos) {
        this.id = Guard.requireNonNull("playlistId", id);
        this.title = Guard.requireNonBlank("title", title);
        this.description = description == null ? "" : description;
        this.channelId = Guard.requireNonNull("channelId", channelId);
        this.publicPlaylist = publicPlaylist;
        this.createdAt = createdAt;
        this.videos = videos;
    }

    public static Playlist create(PlaylistId id, String title, String description, ChannelId channelId,
                                  boolean publicPlaylist) {
        Playlist playlist = new Playlist(id, title, description, channelId, publicPlaylist, Instant.now(),
                MembershipSet.empty("video"));
        playlist.record(new PlaylistCreated(id.value(), playlist.title, channelId.value(), publicPlaylist,
                playlist.createdAt));
        return playlist;
    }

    public static Playlist fromSnapshot(Snapshot snapshot) {
        Playlist playlist = new Playlist(
            PlaylistId.of(snapshot.id()),
            snapshot.title(),
            snapshot.description(),
            ChannelId.of(snapshot.channelId()),
            snapshot.publicPlaylist(),
            snapshot.createdAt(),
            MembershipSet.of("video", snapshot.videoIds().stream().map(VideoId::of).toList())
        );
        playlist.lastSyncedAt = snapshot.lastSyncedAt();
        return playlist;
    }

    public Snapshot toSnapshot() {
        return new Snapshot(id.value(), title, description, channelId.value(), publicPlaylist, createdAt,
                lastSyncedAt, videoIdValues());
    }

    public void addVideo(VideoId videoId) {
        videos.add(videoId);
    }

    public void removeVideo(VideoId videoId) {
        videos.remove(videoId);
    }

    public void syncVideos(List<VideoId> videoIds) {
        videos.replaceAll(videoIds);
        this.lastSyncedAt = Instant.now();
        record(new PlaylistSynced(id.value(), videoIdValues(), lastSyncedAt));
    }

    public void updateDetails(String title, String description) {
        this.title = Guard.requireNonBlank("title", title);
        this.description = description == null ? "" : description;
    }

    public void makePublic() {
        this.publicPlaylist = true;
    }

    public void makePrivate() {
        this.publicPlaylist = false;
    }

    private List<String> videoIdValues() {
        return videos.asList().stream().map(VideoId::value).toList();
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public PlaylistId getId() {
        return id;
    }

    // Getters
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public ChannelId getChannelId() { return channelId; }
    public boolean isPublicPlaylist() { return publicPlaylist; }
    public Instant getCreatedAt() { return createdAt; }
    public Optional<Instant> getLastSyncedAt() { return Optional.ofNullable(lastSyncedAt); }
    public List<VideoId> getVideoIds() { return videos.asList(); }
    public int getVideoCount() { return videos.size(); }

    public record Snapshot(
        String id,
        String title,
        String description,
        String channelId,
        boolean publicPlaylist,
        Instant createdAt,
        Instant lastSyncedAt,
        List<String> videoIds
    ) {
    }
}

package dev.animetracker.entity;

public enum DownloadOutcome {
    SUCCESS,
    FAILED
}

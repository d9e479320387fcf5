package dev.shortlist.model;

public record Education(String degree) {
}

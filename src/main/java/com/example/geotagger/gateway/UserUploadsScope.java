package com.example.geotagger.gateway;

public record UserUploadsScope(String user) implements CrawlScope {
    public UserUploadsScope {
        if (user == null || user.isBlank()) {
            throw new IllegalArgumentException("User scope requires a user name.");
        }
    }

    @Override
    public String describe() {
        return "uploads of " + user;
    }
}

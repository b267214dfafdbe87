package com.example.authengine.domain.entity;

public record SessionWithUser(Session session, User user) {}

package io.b2mash.pms.project;

/** A project with its creator's display name. */
public record ProjectView(Project project, String creatorName) {}

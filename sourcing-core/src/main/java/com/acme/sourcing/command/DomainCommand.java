package com.acme.sourcing.command;

/** Marker interface for commands handled by a {@link CommandHandler}. */
public interface DomainCommand {}

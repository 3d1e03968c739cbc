package com.acme.sourcing.projection;

/** Why a read-model write did not happen. Never fatal to the command that caused it. */
public sealed interface ProjectionError {

  String message();

  record DatabaseError(String message) implements ProjectionError {}

  record NotFound(String message) implements ProjectionError {}
}

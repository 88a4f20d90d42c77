package io.b2mash.crewhours.exception;

import java.util.UUID;

/** Clock-in rejected because the worker already holds an open time block. */
public class AlreadyClockedInException extends ResourceConflictException {

  public AlreadyClockedInException(UUID workerId) {
    super("Already clocked in", "Worker " + workerId + " already has an active time block");
  }
}

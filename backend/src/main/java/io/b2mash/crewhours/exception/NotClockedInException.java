package io.b2mash.crewhours.exception;

import java.util.UUID;

/** Clock-out rejected because the worker holds no open time block. */
public class NotClockedInException extends ResourceConflictException {

  public NotClockedInException(UUID workerId) {
    super("Not clocked in", "Worker " + workerId + " is not currently clocked in");
  }
}

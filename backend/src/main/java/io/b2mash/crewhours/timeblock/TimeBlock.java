package io.b2mash.crewhours.timeblock;

import io.b2mash.crewhours.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.UUID;

/**
 * One contiguous clocked interval of a worker. The block belongs to the calendar day of its
 * clock-in and is never split at midnight.
 *
 * <p>{@code activeWorkerId} mirrors {@code workerId} while the block is open and is cleared on
 * close. The column is unique, so the database admits at most one open block per worker.
 */
@Entity
@Table(name = "time_blocks")
public class TimeBlock {

  private static final double MILLIS_PER_HOUR = 3_600_000.0;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "worker_id", nullable = false)
  private UUID workerId;

  @Column(name = "work_date", nullable = false)
  private LocalDate workDate;

  @Column(name = "block_number", nullable = false)
  private int blockNumber;

  @Column(name = "clock_in_time")
  private Instant clockInTime;

  @Column(name = "clock_out_time")
  private Instant clockOutTime;

  @Column(name = "hours_worked", nullable = false)
  private double hoursWorked;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "active_worker_id", unique = true)
  private UUID activeWorkerId;

  @Column(name = "week_number", nullable = false)
  private int weekNumber;

  @Column(name = "week_year", nullable = false)
  private int weekYear;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TimeBlock() {}

  /** Opens a block. Hours stay at zero until {@link #close(Instant)}. */
  public TimeBlock(UUID workerId, LocalDate date, int blockNumber, Instant clockInTime) {
    this.workerId = workerId;
    this.workDate = date;
    this.blockNumber = blockNumber;
    this.clockInTime = clockInTime;
    this.clockOutTime = null;
    this.hoursWorked = 0.0;
    this.active = true;
    this.activeWorkerId = workerId;
    this.weekNumber = date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    this.weekYear = date.get(IsoFields.WEEK_BASED_YEAR);
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /**
   * Closes this block at {@code clockOutTime}. A clock-out earlier than the clock-in yields
   * negative hours; ordering is the caller's concern.
   */
  public void close(Instant clockOutTime) {
    if (!active) {
      throw new InvalidStateException(
          "Time block closed", "Time block " + id + " was already closed at " + this.clockOutTime);
    }
    if (clockInTime == null) {
      throw new InvalidStateException(
          "Invalid time block state", "Time block " + id + " has no clock-in time");
    }
    this.clockOutTime = clockOutTime;
    this.hoursWorked = hoursBetween(clockInTime, clockOutTime);
    this.active = false;
    this.activeWorkerId = null;
    this.updatedAt = Instant.now();
  }

  /**
   * Hours accrued as of {@code now}: the stored total for a closed block, the running duration for
   * an open one.
   */
  public double elapsedHours(Instant now) {
    if (active) {
      return clockInTime != null ? hoursBetween(clockInTime, now) : 0.0;
    }
    return hoursWorked;
  }

  static double hoursBetween(Instant from, Instant to) {
    return Duration.between(from, to).toMillis() / MILLIS_PER_HOUR;
  }

  public UUID getId() {
    return id;
  }

  public UUID getWorkerId() {
    return workerId;
  }

  public LocalDate getDate() {
    return workDate;
  }

  public int getBlockNumber() {
    return blockNumber;
  }

  public Instant getClockInTime() {
    return clockInTime;
  }

  public Instant getClockOutTime() {
    return clockOutTime;
  }

  public double getHoursWorked() {
    return hoursWorked;
  }

  public boolean isActive() {
    return active;
  }

  public int getWeekNumber() {
    return weekNumber;
  }

  public int getWeekYear() {
    return weekYear;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.domain.model.Constraints;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Day-by-day capacity of a scheduling window, in quarter hours. Day {@code 0} is today; the
 * window ends before the last exam.
 */
final class StudyCalendar {

  enum DayType {
    STUDY,
    BLOCKED,
    REST
  }

  private final LocalDate start;
  private final DayType[] types;
  private final int[] capacity;
  private final int[] used;

  private StudyCalendar(LocalDate start, int days) {
    this.start = start;
    this.types = new DayType[days];
    this.capacity = new int[days];
    this.used = new int[days];
  }

  /** Builds the window {@code [today, endExclusive)}. */
  static StudyCalendar build(LocalDate today, LocalDate endExclusive, Constraints constraints) {
    int days = (int) Math.max(0, ChronoUnit.DAYS.between(today, endExclusive));
    StudyCalendar calendar = new StudyCalendar(today, days);
    for (int i = 0; i < days; i++) {
      LocalDate date = today.plusDays(i);
      if (constraints.isBlocked(date)) {
        calendar.types[i] = DayType.BLOCKED;
      } else {
        calendar.types[i] = DayType.STUDY;
        calendar.capacity[i] = toQuarters(constraints.budgetFor(date));
      }
    }
    return calendar;
  }

  /** Whole quarter hours in {@code hours}, rounded down. */
  static int toQuarters(double hours) {
    return (int) Math.floor(hours * 4 + 1e-9);
  }

  int size() {
    return types.length;
  }

  LocalDate dateAt(int day) {
    return start.plusDays(day);
  }

  /** Index of {@code date} in the window; may be negative or past the end. */
  int indexOf(LocalDate date) {
    return (int) ChronoUnit.DAYS.between(start, date);
  }

  /** Largest capacity of any study day. */
  int maxCapacity() {
    int max = 0;
    for (int i = 0; i < types.length; i++) {
      if (types[i] == DayType.STUDY) {
        max = Math.max(max, capacity[i]);
      }
    }
    return max;
  }

  /** Earliest study day in {@code [from, until)} with {@code quarters} free, or -1. */
  int firstFit(int from, int until, int quarters) {
    int end = Math.min(until, types.length);
    for (int i = Math.max(0, from); i < end; i++) {
      if (types[i] == DayType.STUDY && capacity[i] - used[i] >= quarters) {
        return i;
      }
    }
    return -1;
  }

  void reserve(int day, int quarters) {
    if (types[day] != DayType.STUDY || capacity[day] - used[day] < quarters) {
      throw new IllegalStateException("Day " + day + " cannot take " + quarters + " quarters");
    }
    used[day] += quarters;
  }

  int[] snapshot() {
    return used.clone();
  }

  void restore(int[] snapshot) {
    System.arraycopy(snapshot, 0, used, 0, used.length);
  }

  /** Total study capacity of the days before {@code endExclusive}. */
  int capacityBefore(int endExclusive) {
    int total = 0;
    for (int i = 0; i < Math.min(endExclusive, types.length); i++) {
      if (types[i] == DayType.STUDY) {
        total += capacity[i];
      }
    }
    return total;
  }

  /**
   * Turns study days into rest days after every {@code restAfter} consecutive study days, as long
   * as every deadline after the candidate day keeps at least its required capacity without it.
   *
   * @param deadlines deadline day indexes, ascending
   * @param required capacity required before each deadline, aligned with {@code deadlines}
   * @return the rest days, ascending
   */
  List<LocalDate> insertRestDays(int restAfter, int[] deadlines, long[] required) {
    List<LocalDate> restDays = new ArrayList<>();
    int streak = 0;
    for (int day = 0; day < types.length; day++) {
      if (types[day] != DayType.STUDY) {
        streak = 0;
        continue;
      }
      if (streak >= restAfter && canGiveUp(day, deadlines, required)) {
        types[day] = DayType.REST;
        restDays.add(dateAt(day));
        streak = 0;
        continue;
      }
      streak++;
    }
    return restDays;
  }

  private boolean canGiveUp(int day, int[] deadlines, long[] required) {
    for (int i = 0; i < deadlines.length; i++) {
      if (deadlines[i] <= day) {
        continue;
      }
      if (capacityBefore(deadlines[i]) - capacity[day] < required[i]) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return "StudyCalendar{start=" + start + ", types=" + Arrays.toString(types) + "}";
  }
}

package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.enums.TaskKind;
import com.flamingo.ai.studyplanner.domain.model.Course;
import com.flamingo.ai.studyplanner.domain.model.DroppedTopic;
import com.flamingo.ai.studyplanner.domain.model.StudyPlan;
import com.flamingo.ai.studyplanner.domain.model.StudyTask;
import com.flamingo.ai.studyplanner.exception.SchedulingException;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Deterministic greedy scheduler. Packs learn, practice and review sessions of every topic into
 * the days before each course's exam without exceeding any day's budget.
 *
 * <p>All arithmetic is done in whole quarter hours.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StudyScheduler {

  /** Capacity that must remain before each deadline, relative to its demand, to allow a rest. */
  private static final double REST_DAY_HEADROOM = 1.2;

  private static final int MIN_REVIEW_QUARTERS = 2;
  private static final int MAX_REVIEW_QUARTERS = 6;
  private static final int MIN_TOPIC_QUARTERS = 2;

  private final PlannerConfig plannerConfig;
  private final TaskNoteGenerator taskNoteGenerator;

  /**
   * Builds the plan.
   *
   * @throws SchedulingException when there is nothing to schedule, no exam date is known, or not
   *     a single task fits
   */
  @Timed(value = "scheduler.schedule", description = "Time to build a study schedule")
  public StudyPlan schedule(SchedulingRequest request) {
    if (request.courses().isEmpty()) {
      throw SchedulingException.noCourses();
    }
    List<CourseWorkload> withTopics =
        request.courses().stream().filter(c -> !c.topics().isEmpty()).toList();
    if (withTopics.isEmpty()) {
      throw SchedulingException.noTopics();
    }
    LocalDate lastExam =
        withTopics.stream()
            .map(CourseWorkload::examDate)
            .filter(Objects::nonNull)
            .max(Comparator.naturalOrder())
            .orElseThrow(SchedulingException::noExamDate);

    StudyCalendar calendar =
        StudyCalendar.build(request.today(), lastExam, request.constraints());
    int maxTaskQuarters = calendar.maxCapacity();
    if (maxTaskQuarters == 0) {
      throw SchedulingException.nothingFits();
    }

    List<PlannedCourse> courses = plan(request.courses(), lastExam, calendar, maxTaskQuarters);
    List<LocalDate> restDays = insertRestDays(courses, calendar);

    List<PlacedTask> placed = new ArrayList<>();
    List<DroppedTopic> dropped = new ArrayList<>();
    for (PlannedCourse course : courses) {
      place(course, calendar, request, placed, dropped);
    }
    if (placed.isEmpty()) {
      throw SchedulingException.nothingFits();
    }

    placed.sort(
        Comparator.comparing((PlacedTask p) -> p.task().date())
            .thenComparingInt(PlacedTask::courseOrder)
            .thenComparingInt(PlacedTask::topicRank)
            .thenComparing(p -> p.task().kind()));

    log.info(
        "Scheduled {} tasks for {} courses over {} days ({} rest days, {} topics dropped)",
        placed.size(),
        courses.size(),
        calendar.size(),
        restDays.size(),
        dropped.size());
    return new StudyPlan(placed.stream().map(PlacedTask::task).toList(), restDays, dropped);
  }

  /**
   * Orders courses by deadline, then real exam dates before borrowed ones, then input order. Ranks
   * their topics and sizes their tasks.
   */
  private List<PlannedCourse> plan(
      List<CourseWorkload> courses,
      LocalDate lastExam,
      StudyCalendar calendar,
      int maxTaskQuarters) {
    List<PlannedCourse> planned = new ArrayList<>();
    for (int inputOrder = 0; inputOrder < courses.size(); inputOrder++) {
      CourseWorkload workload = courses.get(inputOrder);
      if (workload.topics().isEmpty()) {
        continue;
      }
      boolean knownDate = workload.examDate() != null;
      LocalDate examDate = knownDate ? workload.examDate() : lastExam;
      int deadline = Math.max(0, Math.min(calendar.size(), calendar.indexOf(examDate)));
      planned.add(
          new PlannedCourse(
              workload.course(),
              examDate,
              knownDate,
              deadline,
              inputOrder,
              rankTopics(workload, maxTaskQuarters)));
    }
    planned.sort(
        Comparator.comparing(PlannedCourse::examDate)
            .thenComparing(course -> !course.knownDate())
            .thenComparingInt(PlannedCourse::inputOrder));
    return planned;
  }

  /**
   * Sorts topics by importance, ties by original order. Repeated names keep their first (most
   * important) occurrence only, so task identities stay unique.
   */
  private List<RankedTopic> rankTopics(CourseWorkload workload, int maxTaskQuarters) {
    List<Integer> order = new ArrayList<>();
    for (int i = 0; i < workload.topics().size(); i++) {
      order.add(i);
    }
    order.sort(
        Comparator.comparing((Integer i) -> workload.topics().get(i).importance())
            .thenComparingInt(i -> i));

    List<RankedTopic> ranked = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (int index : order) {
      TopicWorkload topic = workload.topics().get(index);
      if (!seen.add(topic.name().toLowerCase(Locale.ROOT))) {
        log.debug("Ignoring repeated topic '{}' in {}", topic.name(), workload.course().code());
        continue;
      }
      ranked.add(size(topic, maxTaskQuarters));
    }
    return ranked;
  }

  private RankedTopic size(TopicWorkload topic, int maxTaskQuarters) {
    // past this bound every session is already at its ceiling
    long ceiling = Math.max(2L * maxTaskQuarters, 4L * MAX_REVIEW_QUARTERS);
    long quarters = Math.min(Math.round(topic.hours() * 4), ceiling);
    int total = (int) Math.max(MIN_TOPIC_QUARTERS, quarters);
    int learn = (total + 1) / 2;
    int practice = total - learn;
    int review =
        Math.max(MIN_REVIEW_QUARTERS, Math.min(MAX_REVIEW_QUARTERS, Math.round(total / 4f)));
    return new RankedTopic(
        topic,
        Math.min(learn, maxTaskQuarters),
        Math.min(practice, maxTaskQuarters),
        Math.min(review, maxTaskQuarters));
  }

  private List<LocalDate> insertRestDays(List<PlannedCourse> courses, StudyCalendar calendar) {
    // courses are sorted by deadline, so the running sum is the demand due by each deadline
    int[] deadlines = new int[courses.size()];
    long[] required = new long[courses.size()];
    long cumulative = 0;
    for (int i = 0; i < courses.size(); i++) {
      PlannedCourse course = courses.get(i);
      cumulative += course.topics().stream().mapToInt(RankedTopic::totalQuarters).sum();
      deadlines[i] = course.deadline();
      required[i] = (long) Math.ceil(cumulative * REST_DAY_HEADROOM);
    }
    return calendar.insertRestDays(
        plannerConfig.getSchedule().getRestAfterStudyDays(), deadlines, required);
  }

  private void place(
      PlannedCourse course,
      StudyCalendar calendar,
      SchedulingRequest request,
      List<PlacedTask> placed,
      List<DroppedTopic> dropped) {
    List<RankedTopic> topics = course.topics();
    for (int rank = 0; rank < topics.size(); rank++) {
      int[] snapshot = calendar.snapshot();
      List<PlacedTask> tasks = placeTopic(course, rank, calendar, request);
      if (tasks == null) {
        calendar.restore(snapshot);
        // lowest importance first
        for (int i = topics.size() - 1; i >= rank; i--) {
          TopicWorkload topic = topics.get(i).topic();
          dropped.add(
              new DroppedTopic(
                  course.course().id(),
                  topic.name(),
                  topic.importance(),
                  "Not enough study time before the exam on " + course.examDate()));
        }
        log.info(
            "Dropped {} of {} topics of {}: not enough time before {}",
            topics.size() - rank,
            topics.size(),
            course.course().code(),
            course.examDate());
        return;
      }
      placed.addAll(tasks);
    }
  }

  /** Places the three sessions of one topic, or returns null when they do not all fit. */
  private List<PlacedTask> placeTopic(
      PlannedCourse course, int rank, StudyCalendar calendar, SchedulingRequest request) {
    RankedTopic topic = course.topics().get(rank);
    int deadline = course.deadline();

    int learnDay = calendar.firstFit(0, deadline, topic.learnQuarters());
    if (learnDay < 0) {
      return null;
    }
    calendar.reserve(learnDay, topic.learnQuarters());

    int practiceDay = calendar.firstFit(learnDay, deadline, topic.practiceQuarters());
    if (practiceDay < 0) {
      return null;
    }
    calendar.reserve(practiceDay, topic.practiceQuarters());

    int gap = request.constraints().cadence().gapDays();
    int reviewDay = calendar.firstFit(practiceDay + gap, deadline, topic.reviewQuarters());
    if (reviewDay < 0) {
      reviewDay = calendar.firstFit(practiceDay, deadline, topic.reviewQuarters());
    }
    if (reviewDay < 0) {
      return null;
    }
    calendar.reserve(reviewDay, topic.reviewQuarters());

    return List.of(
        task(course, rank, topic, TaskKind.LEARN, learnDay, topic.learnQuarters(), calendar),
        task(
            course,
            rank,
            topic,
            TaskKind.PRACTICE,
            practiceDay,
            topic.practiceQuarters(),
            calendar),
        task(course, rank, topic, TaskKind.REVIEW, reviewDay, topic.reviewQuarters(), calendar));
  }

  private PlacedTask task(
      PlannedCourse course,
      int rank,
      RankedTopic topic,
      TaskKind kind,
      int day,
      int quarters,
      StudyCalendar calendar) {
    TopicWorkload workload = topic.topic();
    Course c = course.course();
    StudyTask task =
        new StudyTask(
            calendar.dateAt(day),
            c.id(),
            c.code(),
            c.color(),
            workload.name(),
            kind,
            quarters / 4.0,
            workload.resource(),
            taskNoteGenerator.notesFor(workload.name(), workload.resource(), kind),
            false,
            false);
    return new PlacedTask(task, course.inputOrder(), rank);
  }

  private record PlannedCourse(
      Course course,
      LocalDate examDate,
      boolean knownDate,
      int deadline,
      int inputOrder,
      List<RankedTopic> topics) {}

  private record RankedTopic(
      TopicWorkload topic, int learnQuarters, int practiceQuarters, int reviewQuarters) {

    int totalQuarters() {
      return learnQuarters + practiceQuarters + reviewQuarters;
    }
  }

  private record PlacedTask(StudyTask task, int courseOrder, int topicRank) {}
}

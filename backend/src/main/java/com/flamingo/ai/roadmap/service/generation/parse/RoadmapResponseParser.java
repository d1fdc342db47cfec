package com.flamingo.ai.roadmap.service.generation.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.IntNode;
import com.flamingo.ai.roadmap.domain.enums.TaskType;
import com.flamingo.ai.roadmap.domain.enums.WeekOrigin;
import com.flamingo.ai.roadmap.domain.model.LearningResource;
import com.flamingo.ai.roadmap.domain.model.Milestone;
import com.flamingo.ai.roadmap.domain.model.RoadmapDay;
import com.flamingo.ai.roadmap.domain.model.RoadmapTask;
import com.flamingo.ai.roadmap.domain.model.RoadmapWeek;
import com.flamingo.ai.roadmap.domain.model.WeekBatch;
import com.flamingo.ai.roadmap.service.generation.parse.dto.BatchPayload;
import com.flamingo.ai.roadmap.service.generation.parse.dto.DayPayload;
import com.flamingo.ai.roadmap.service.generation.parse.dto.MilestonePayload;
import com.flamingo.ai.roadmap.service.generation.parse.dto.ResourcePayload;
import com.flamingo.ai.roadmap.service.generation.parse.dto.TaskPayload;
import com.flamingo.ai.roadmap.service.generation.parse.dto.WeekPayload;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns raw provider text into validated roadmap weeks.
 *
 * <p>Strategies, in order:
 *
 * <ol>
 *   <li>strict parse of the whole text as a {@link BatchPayload};
 *   <li>lenient parse of the largest balanced JSON fragment found in the text (object payload or a
 *       bare array of weeks);
 *   <li>salvage of individual week objects, e.g. the complete weeks of a truncated response;
 * </ol>
 *
 * otherwise a {@link GenerationOutcome.ParseFailure}. Field-level problems drop the offending
 * record with a warning instead of failing the whole batch.
 */
@Component
@Slf4j
public class RoadmapResponseParser {

  private static final int MAX_PREVIEW_CHARS = 200;

  private final ObjectMapper objectMapper;
  private final ObjectReader strictReader;

  public RoadmapResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.strictReader =
        objectMapper
            .readerFor(BatchPayload.class)
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /**
   * Parses one batch response.
   *
   * @param rawText provider output, may be null
   * @param batch the week range that was requested
   * @return {@link GenerationOutcome.Success} or {@link GenerationOutcome.ParseFailure}
   */
  public GenerationOutcome parse(String rawText, WeekBatch batch) {
    if (rawText == null || rawText.isBlank()) {
      return new GenerationOutcome.ParseFailure(rawText, "Empty response");
    }

    List<String> warnings = new ArrayList<>();
    Optional<BatchPayload> payload = parseStrict(rawText);
    if (payload.isEmpty()) {
      log.debug("Strict parse failed for {}, trying lenient extraction", batch);
      payload = parseLenient(rawText);
      payload.ifPresent(p -> warnings.add("Recovered JSON embedded in surrounding text"));
    }
    if (payload.isEmpty()) {
      payload = salvageWeeks(rawText);
      payload.ifPresent(
          p ->
              warnings.add(
                  "Salvaged " + p.weeks().size() + " complete week(s) from truncated text"));
    }
    if (payload.isEmpty()) {
      log.warn("No roadmap JSON found in response for {}: '{}'", batch, preview(rawText));
      return new GenerationOutcome.ParseFailure(rawText, "No valid roadmap JSON found in response");
    }

    return validate(payload.get(), batch, rawText, warnings);
  }

  /**
   * Serializes weeks back into the batch payload schema. Parsing the result for the same range
   * yields the same weeks.
   */
  public String render(List<RoadmapWeek> weeks, List<Milestone> milestones) {
    BatchPayload payload =
        new BatchPayload(
            null,
            null,
            weeks.stream().map(this::toPayload).toList(),
            milestones == null || milestones.isEmpty()
                ? null
                : milestones.stream().map(this::toPayload).toList());
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Failed to render roadmap weeks", e);
    }
  }

  private Optional<BatchPayload> parseStrict(String text) {
    try {
      BatchPayload payload = strictReader.readValue(text.trim());
      return payload != null && payload.hasWeeks() ? Optional.of(payload) : Optional.empty();
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
  }

  private Optional<BatchPayload> parseLenient(String text) {
    String unfenced = JsonFragmentExtractor.stripCodeFences(text);
    if (!unfenced.equals(text.trim())) {
      Optional<BatchPayload> fenced = parseStrict(unfenced);
      if (fenced.isPresent()) {
        return fenced;
      }
    }
    for (String fragment : JsonFragmentExtractor.fragmentsBySize(unfenced)) {
      Optional<BatchPayload> payload = parseFragment(fragment);
      if (payload.isPresent()) {
        return payload;
      }
    }
    return Optional.empty();
  }

  private Optional<BatchPayload> parseFragment(String fragment) {
    if (fragment.startsWith("[")) {
      try {
        List<WeekPayload> weeks =
            objectMapper.readValue(fragment, new TypeReference<List<WeekPayload>>() {});
        List<WeekPayload> real =
            weeks.stream().filter(Objects::nonNull).filter(WeekPayload::looksLikeWeek).toList();
        return real.isEmpty()
            ? Optional.empty()
            : Optional.of(new BatchPayload(null, null, real, null));
      } catch (JsonProcessingException e) {
        return Optional.empty();
      }
    }
    return parseStrict(fragment);
  }

  private Optional<BatchPayload> salvageWeeks(String text) {
    List<WeekPayload> weeks = new ArrayList<>();
    collectWeeks(JsonFragmentExtractor.stripCodeFences(text), weeks);
    return weeks.isEmpty()
        ? Optional.empty()
        : Optional.of(new BatchPayload(null, null, List.copyOf(weeks), null));
  }

  /** Collects complete week objects, descending into fragments that are not weeks themselves. */
  private void collectWeeks(String text, List<WeekPayload> sink) {
    for (String fragment : JsonFragmentExtractor.fragmentsInOrder(text)) {
      Optional<WeekPayload> week = fragment.startsWith("{") ? readWeek(fragment) : Optional.empty();
      if (week.isPresent()) {
        sink.add(week.get());
      } else if (fragment.length() > 2) {
        collectWeeks(fragment.substring(1, fragment.length() - 1), sink);
      }
    }
  }

  private Optional<WeekPayload> readWeek(String fragment) {
    try {
      WeekPayload week = objectMapper.readValue(fragment, WeekPayload.class);
      return week != null && week.looksLikeWeek() ? Optional.of(week) : Optional.empty();
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
  }

  private GenerationOutcome validate(
      BatchPayload payload, WeekBatch batch, String rawText, List<String> warnings) {
    List<RoadmapWeek> weeks = new ArrayList<>();
    Set<Integer> seen = new HashSet<>();

    for (WeekPayload weekPayload : payload.weeks()) {
      if (weekPayload == null) {
        continue;
      }
      Integer number = weekPayload.weekNumber();
      if (number == null) {
        warnings.add("Dropped week without week_number");
        continue;
      }
      if (!batch.contains(number)) {
        warnings.add("Dropped week " + number + " outside requested " + batch);
        continue;
      }
      if (!seen.add(number)) {
        warnings.add("Dropped duplicate week " + number);
        continue;
      }
      toWeek(weekPayload, warnings).ifPresent(weeks::add);
    }

    if (weeks.isEmpty()) {
      String detail = "No valid weeks for " + batch;
      if (!warnings.isEmpty()) {
        detail += ": " + String.join("; ", warnings);
      }
      return new GenerationOutcome.ParseFailure(rawText, detail);
    }

    weeks.sort(Comparator.comparingInt(RoadmapWeek::weekNumber));
    List<Milestone> milestones = toMilestones(payload.milestones(), batch);

    if (!warnings.isEmpty()) {
      log.debug("Parsed {} with {} warning(s): {}", batch, warnings.size(), warnings);
    }
    return new GenerationOutcome.Success(
        weeks,
        milestones,
        blankToNull(payload.roadmapTitle()),
        blankToNull(payload.description()),
        warnings);
  }

  private Optional<RoadmapWeek> toWeek(WeekPayload payload, List<String> warnings) {
    int weekNumber = payload.weekNumber();
    List<DayPayload> dayPayloads =
        payload.days() == null
            ? List.of()
            : payload.days().stream()
                .filter(Objects::nonNull)
                .sorted(
                    Comparator.comparing(
                        DayPayload::dayNumber, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();

    List<RoadmapDay> days = new ArrayList<>();
    for (DayPayload dayPayload : dayPayloads) {
      String where = "week " + weekNumber + " day " + dayPayload.dayNumber();
      List<RoadmapTask> tasks = new ArrayList<>();
      if (dayPayload.tasks() != null) {
        for (TaskPayload taskPayload : dayPayload.tasks()) {
          toTask(taskPayload, where, warnings).ifPresent(tasks::add);
        }
      }
      if (tasks.isEmpty()) {
        warnings.add("Dropped " + where + ": no valid tasks");
        continue;
      }
      days.add(new RoadmapDay(days.size() + 1, tasks));
    }

    if (days.isEmpty()) {
      warnings.add("Dropped week " + weekNumber + ": no valid days");
      return Optional.empty();
    }

    String focusArea =
        payload.focusArea() == null || payload.focusArea().isBlank()
            ? "Week " + weekNumber
            : payload.focusArea().trim();
    return Optional.of(
        new RoadmapWeek(
            weekNumber,
            focusArea,
            cleanList(payload.learningObjectives()),
            days,
            WeekOrigin.GENERATED));
  }

  private Optional<RoadmapTask> toTask(TaskPayload payload, String where, List<String> warnings) {
    if (payload == null) {
      return Optional.empty();
    }
    if (payload.title() == null || payload.title().isBlank()) {
      warnings.add("Dropped task without title in " + where);
      return Optional.empty();
    }
    String title = payload.title().trim();
    Integer difficulty = wholeNumber(payload.difficulty());
    if (difficulty == null
        || difficulty < RoadmapTask.MIN_DIFFICULTY
        || difficulty > RoadmapTask.MAX_DIFFICULTY) {
      warnings.add(
          "Dropped task '" + title + "' in " + where + ": difficulty " + payload.difficulty());
      return Optional.empty();
    }
    Integer minutes = wholeNumber(payload.estimatedDuration());
    if (minutes == null || minutes <= 0) {
      warnings.add(
          "Dropped task '"
              + title
              + "' in "
              + where
              + ": estimated minutes "
              + payload.estimatedDuration());
      return Optional.empty();
    }

    TaskType type =
        TaskType.fromLabel(payload.taskType())
            .orElseGet(
                () -> {
                  warnings.add(
                      "Unknown task type '"
                          + payload.taskType()
                          + "' for '"
                          + title
                          + "', using reading");
                  return TaskType.READING;
                });

    List<LearningResource> resources =
        payload.resources() == null
            ? List.of()
            : payload.resources().stream()
                .filter(Objects::nonNull)
                .filter(r -> r.title() != null && !r.title().isBlank())
                .map(r -> new LearningResource(r.title().trim(), r.url(), r.type()))
                .toList();
    if (resources.size() > RoadmapTask.MAX_RESOURCES) {
      warnings.add("Trimmed resources of '" + title + "' to " + RoadmapTask.MAX_RESOURCES);
      resources = resources.subList(0, RoadmapTask.MAX_RESOURCES);
    }

    return Optional.of(
        new RoadmapTask(
            title,
            payload.description() == null ? "" : payload.description().trim(),
            type,
            minutes,
            difficulty,
            cleanList(payload.learningObjectives()),
            payload.successCriteria() == null ? "" : payload.successCriteria().trim(),
            new LinkedHashSet<>(cleanList(payload.prerequisites())),
            resources));
  }

  private List<Milestone> toMilestones(List<MilestonePayload> payloads, WeekBatch batch) {
    if (payloads == null) {
      return List.of();
    }
    return payloads.stream()
        .filter(Objects::nonNull)
        .filter(m -> m.weekNumber() != null && batch.contains(m.weekNumber()))
        .filter(m -> m.title() != null && !m.title().isBlank())
        .map(
            m ->
                new Milestone(
                    m.weekNumber(),
                    m.title().trim(),
                    m.description() == null ? "" : m.description(),
                    cleanList(m.skillsDemonstrated()),
                    m.deliverable() == null ? "" : m.deliverable()))
        .toList();
  }

  private WeekPayload toPayload(RoadmapWeek week) {
    return new WeekPayload(
        week.weekNumber(),
        week.focusArea(),
        week.learningObjectives(),
        week.days().stream()
            .map(
                day ->
                    new DayPayload(
                        day.dayNumber(), day.tasks().stream().map(this::toPayload).toList()))
            .toList());
  }

  private TaskPayload toPayload(RoadmapTask task) {
    return new TaskPayload(
        task.title(),
        task.description(),
        task.type().label(),
        IntNode.valueOf(task.estimatedMinutes()),
        IntNode.valueOf(task.difficulty()),
        task.learningObjectives(),
        task.successCriteria(),
        List.copyOf(task.prerequisites()),
        task.resources().stream()
            .map(r -> new ResourcePayload(r.title(), r.url(), r.type()))
            .toList());
  }

  private MilestonePayload toPayload(Milestone milestone) {
    return new MilestonePayload(
        milestone.weekNumber(),
        milestone.title(),
        milestone.description(),
        milestone.skillsDemonstrated(),
        milestone.deliverable());
  }

  private static List<String> cleanList(List<String> values) {
    if (values == null) {
      return List.of();
    }
    return values.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(v -> !v.isEmpty())
        .toList();
  }

  /** Integral number or numeric string, else null. */
  private static Integer wholeNumber(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isIntegralNumber() && node.canConvertToInt()) {
      return node.intValue();
    }
    if (node.isTextual()) {
      try {
        return Integer.valueOf(node.textValue().trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static String preview(String text) {
    return text.length() > MAX_PREVIEW_CHARS ? text.substring(0, MAX_PREVIEW_CHARS) + "..." : text;
  }
}

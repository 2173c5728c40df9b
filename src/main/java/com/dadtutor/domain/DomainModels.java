package com.dadtutor.domain;

import com.dadtutor.taxonomy.ClassifiableItem;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public class DomainModels {

    public enum ExamStatus {
        UPLOADING, PROCESSING, COMPLETED, FAILED;

        @JsonValue
        public String wireValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static ExamStatus fromWireValue(String value) {
            return Arrays.stream(values())
                    .filter(s -> s.name().equalsIgnoreCase(value == null ? "" : value.trim()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown exam status: " + value));
        }

        public boolean canTransitionTo(ExamStatus next) {
            return switch (this) {
                case UPLOADING -> next == PROCESSING || next == COMPLETED || next == FAILED;
                case PROCESSING -> next == COMPLETED || next == FAILED;
                case FAILED -> next == PROCESSING;
                case COMPLETED -> false;
            };
        }
    }

    public enum Difficulty {
        EASY("Easy"), MEDIUM("Medium"), HARD("Hard");

        private final String label;

        Difficulty(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }

        @JsonCreator
        public static Difficulty fromLabel(String value) {
            if (value == null || value.isBlank()) return null;
            return Arrays.stream(values())
                    .filter(d -> d.label.equalsIgnoreCase(value.trim()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown difficulty: " + value));
        }
    }

    /** An uploaded exam; classified by the subject of its extracted solution. */
    public record ExamPaper(String id,
                            String filename,
                            ExamStatus status,
                            Instant uploadDate,
                            String errorMessage,
                            ExamSolution solution) implements ClassifiableItem {
        @Override
        public String subject() {
            return solution == null ? null : solution.subject();
        }

        @Override
        public String topic() {
            return null;
        }

        public ExamPaper withStatus(ExamStatus newStatus, String newErrorMessage) {
            return new ExamPaper(id, filename, newStatus, uploadDate, newErrorMessage, solution);
        }

        public ExamPaper withSolution(ExamSolution newSolution) {
            return new ExamPaper(id, filename, status, uploadDate, errorMessage, newSolution);
        }
    }

    public record ExamSolution(String subject,
                               String year,
                               Difficulty difficulty,
                               List<String> topics,
                               List<QuestionAnalysis> questions,
                               String summary) {
        public ExamSolution {
            topics = topics == null ? List.of() : List.copyOf(topics);
            questions = questions == null ? List.of() : List.copyOf(questions);
        }
    }

    public record QuestionAnalysis(String questionNumber,
                                   String questionText,
                                   String solution,
                                   String explanation,
                                   String topic) implements ClassifiableItem {
        @Override
        public String subject() {
            return null;
        }
    }

    public record Formula(String name, String formula, String description) {}

    public record StudyGuide(String id,
                             String topic,
                             String subject,
                             String summaryMarkdown,
                             List<String> keyConcepts,
                             List<Formula> formulas,
                             List<String> commonMistakes,
                             Instant createdAt,
                             Instant updatedAt) implements ClassifiableItem {
        public StudyGuide {
            keyConcepts = keyConcepts == null ? List.of() : List.copyOf(keyConcepts);
            formulas = formulas == null ? List.of() : List.copyOf(formulas);
            commonMistakes = commonMistakes == null ? List.of() : List.copyOf(commonMistakes);
        }
    }

    public record StudyPlan(String id,
                            String examId,
                            String title,
                            String overview,
                            List<String> criticalTopics,
                            List<StudyPlanDay> schedule,
                            String markdownPlan,
                            Instant createdAt) {
        public StudyPlan {
            criticalTopics = criticalTopics == null ? List.of() : List.copyOf(criticalTopics);
            schedule = schedule == null ? List.of() : List.copyOf(schedule);
        }
    }

    public record StudyPlanDay(int day, LocalDate date, String focus, List<String> tasks, int durationMinutes) {
        public StudyPlanDay {
            tasks = tasks == null ? List.of() : List.copyOf(tasks);
        }
    }

    public record ExamStats(int totalPapers, int solvedCount, int papersThisWeek, int uniqueTopics, int hardCount) {}
}

package com.dadtutor.progress;

import java.time.Instant;
import java.util.List;

public class ProgressModels {

    public record PracticeSession(String id,
                                  String examId,
                                  String examName,
                                  Instant sessionDate,
                                  int totalQuestions,
                                  int correctCount,
                                  int incorrectCount,
                                  int scorePercentage) {}

    public record RecordSessionRequest(String examId,
                                       String examName,
                                       Instant sessionDate,
                                       Integer totalQuestions,
                                       Integer correctCount,
                                       Integer incorrectCount,
                                       Integer scorePercentage) {}

    public record ProgressSnapshot(int masteryRate,
                                   int totalSessions,
                                   List<PracticeSession> recentSessions,
                                   int streak) {}

    public record ProgressCounters(long questionsMastered, long questionsAttempted) {
        public static ProgressCounters none() {
            return new ProgressCounters(0, 0);
        }
    }

    /**
     * How sessions sharing a calendar day are treated when counting the streak.
     */
    public enum StreakPolicy {
        /** Collapse sessions to distinct calendar days first. */
        DEDUPE_BY_DAY,
        /** Walk session by session; a second session on the same day ends the chain. */
        PER_SESSION
    }
}

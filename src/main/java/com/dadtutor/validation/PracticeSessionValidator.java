package com.dadtutor.validation;

import com.dadtutor.progress.ProgressModels.RecordSessionRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class PracticeSessionValidator {

    public List<ValidationError> validate(RecordSessionRequest request) {
        List<ValidationError> errors = new ArrayList<>();
        if (request == null) {
            errors.add(new ValidationError("MISSING_BODY", null, "Practice session payload is required"));
            return errors;
        }

        if (request.examName() == null || request.examName().isBlank()) {
            errors.add(new ValidationError("MISSING_FIELD", "examName", "examName is required"));
        }
        required(request.totalQuestions(), "totalQuestions", errors);
        required(request.correctCount(), "correctCount", errors);
        required(request.incorrectCount(), "incorrectCount", errors);
        nonNegative(request.totalQuestions(), "totalQuestions", errors);
        nonNegative(request.correctCount(), "correctCount", errors);
        nonNegative(request.incorrectCount(), "incorrectCount", errors);

        if (request.totalQuestions() != null && request.correctCount() != null && request.incorrectCount() != null) {
            long answered = (long) request.correctCount() + request.incorrectCount();
            if (answered > request.totalQuestions()) {
                errors.add(new ValidationError("COUNT_MISMATCH", "totalQuestions",
                        "correctCount + incorrectCount (" + answered + ") exceeds totalQuestions (" + request.totalQuestions() + ")"));
            }
        }

        Integer score = request.scorePercentage();
        if (score != null && (score < 0 || score > 100)) {
            errors.add(new ValidationError("OUT_OF_RANGE", "scorePercentage", "scorePercentage must be between 0 and 100, was " + score));
        }
        return errors;
    }

    private void required(Integer value, String field, List<ValidationError> errors) {
        if (value == null) errors.add(new ValidationError("MISSING_FIELD", field, field + " is required"));
    }

    private void nonNegative(Integer value, String field, List<ValidationError> errors) {
        if (value != null && value < 0) {
            errors.add(new ValidationError("NEGATIVE_COUNT", field, field + " must not be negative, was " + value));
        }
    }
}

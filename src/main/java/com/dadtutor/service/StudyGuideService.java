package com.dadtutor.service;

import com.dadtutor.domain.DomainModels.ExamPaper;
import com.dadtutor.domain.DomainModels.ExamSolution;
import com.dadtutor.domain.DomainModels.ExamStatus;
import com.dadtutor.domain.DomainModels.Formula;
import com.dadtutor.domain.DomainModels.QuestionAnalysis;
import com.dadtutor.domain.DomainModels.StudyGuide;
import com.dadtutor.exception.NotFoundException;
import com.dadtutor.repository.ExamJdbcRepository;
import com.dadtutor.repository.TopicSummaryJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
public class StudyGuideService {
    private final TopicSummaryJdbcRepository repository;
    private final ExamJdbcRepository examRepository;
    private final Clock clock;

    public StudyGuideService(TopicSummaryJdbcRepository repository, ExamJdbcRepository examRepository, Clock clock) {
        this.repository = repository;
        this.examRepository = examRepository;
        this.clock = clock;
    }

    /** Creates the guide for a topic, or replaces its content keeping id and creation time. */
    public StudyGuide save(SaveGuideRequest request) {
        if (request == null || request.topic() == null || request.topic().isBlank()) {
            throw new IllegalArgumentException("topic is required");
        }
        String topic = request.topic().trim();
        Instant now = Instant.now(clock);
        Optional<StudyGuide> existing = repository.findByTopic(topic);

        StudyGuide guide = new StudyGuide(
                existing.map(StudyGuide::id).orElseGet(() -> UUID.randomUUID().toString()),
                topic, request.subject(), request.summaryMarkdown(),
                request.keyConcepts(), request.formulas(), request.commonMistakes(),
                existing.map(StudyGuide::createdAt).orElse(now), now);
        repository.upsert(guide);
        log.info("{} study guide '{}'", existing.isPresent() ? "Updated" : "Created", topic);
        return guide;
    }

    public StudyGuide get(String id) {
        return repository.findById(id).orElseThrow(() -> new NotFoundException("Study guide not found: " + id));
    }

    public List<StudyGuide> list() {
        return repository.findAll();
    }

    /**
     * Topics found in completed exams, solution topics first then question topics, that do
     * not have a guide yet.
     */
    public List<String> availableTopics() {
        Set<String> covered = repository.findAll().stream().map(StudyGuide::topic).collect(Collectors.toSet());
        Set<String> topics = new LinkedHashSet<>();
        for (ExamPaper exam : examRepository.findAll()) {
            if (exam.status() != ExamStatus.COMPLETED || exam.solution() == null) continue;
            ExamSolution solution = exam.solution();
            solution.topics().stream().filter(Objects::nonNull).map(String::trim).filter(t -> !t.isEmpty()).forEach(topics::add);
            solution.questions().stream().map(QuestionAnalysis::topic)
                    .filter(Objects::nonNull).map(String::trim).filter(t -> !t.isEmpty()).forEach(topics::add);
        }
        topics.removeAll(covered);
        return List.copyOf(topics);
    }

    public record SaveGuideRequest(String topic,
                                   String subject,
                                   String summaryMarkdown,
                                   List<String> keyConcepts,
                                   List<Formula> formulas,
                                   List<String> commonMistakes) {}
}

package com.dadtutor.service;

import com.dadtutor.domain.DomainModels.ExamPaper;
import com.dadtutor.domain.DomainModels.QuestionAnalysis;
import com.dadtutor.domain.DomainModels.StudyGuide;
import com.dadtutor.grouping.GroupingEngine;
import com.dadtutor.grouping.GroupingModels.GroupVisibility;
import com.dadtutor.grouping.GroupingModels.GroupedView;
import com.dadtutor.grouping.GroupingModels.TaxonomyGrouping;
import com.dadtutor.repository.ExamJdbcRepository;
import com.dadtutor.repository.TopicSummaryJdbcRepository;
import com.dadtutor.taxonomy.TaxonomyModels.Specialization;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

@Service
public class LibraryService {
    private final GroupingEngine groupingEngine;
    private final ExamJdbcRepository examRepository;
    private final TopicSummaryJdbcRepository guideRepository;
    private final ExamService examService;
    private final SettingsService settingsService;

    public LibraryService(GroupingEngine groupingEngine,
                          ExamJdbcRepository examRepository,
                          TopicSummaryJdbcRepository guideRepository,
                          ExamService examService,
                          SettingsService settingsService) {
        this.groupingEngine = groupingEngine;
        this.examRepository = examRepository;
        this.guideRepository = guideRepository;
        this.examService = examService;
        this.settingsService = settingsService;
    }

    public GroupedView<ExamPaper> groupExams(String search) {
        List<ExamPaper> exams = examRepository.findAll().stream()
                .filter(e -> matchesSearch(e, search))
                .toList();
        return view(groupingEngine.group(exams, settingsService.specialization()));
    }

    public GroupedView<StudyGuide> groupStudyGuides() {
        return view(groupingEngine.group(guideRepository.findAll(), settingsService.specialization()));
    }

    public GroupedView<QuestionAnalysis> groupQuestions(String examId) {
        ExamPaper exam = examService.get(examId);
        List<QuestionAnalysis> questions = exam.solution() == null ? List.of() : exam.solution().questions();
        Specialization specialization = settingsService.specialization();
        return view(groupingEngine.group(questions, specialization));
    }

    static boolean matchesSearch(ExamPaper exam, String search) {
        if (search == null || search.isBlank()) return true;
        String term = search.trim().toLowerCase(Locale.ROOT);
        if (contains(exam.filename(), term)) return true;
        if (exam.solution() == null) return false;
        return contains(exam.solution().subject(), term)
                || (exam.solution().difficulty() != null && contains(exam.solution().difficulty().label(), term));
    }

    private static boolean contains(String value, String term) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(term);
    }

    private <T> GroupedView<T> view(TaxonomyGrouping<T> grouping) {
        return new GroupedView<>(grouping, GroupVisibility.defaults(), grouping.total());
    }
}

package com.campus.timetable.optimizer;

import com.campus.timetable.config.OptimizerSettings;
import com.campus.timetable.domain.DomainModels.Course;
import com.campus.timetable.domain.DomainModels.ScheduleConstraints;
import com.campus.timetable.optimizer.OptimizerModels.OptimizationRequest;
import com.campus.timetable.optimizer.OptimizerModels.OptimizedSchedule;
import com.campus.timetable.optimizer.OptimizerModels.ScheduleOptimization;
import com.campus.timetable.recommendation.ScheduleRecommendationWriter;
import com.campus.timetable.validation.InvalidScheduleRequestException;
import com.campus.timetable.validation.ScheduleRequestValidator;
import com.campus.timetable.validation.ScheduleRequestValidator.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ScheduleOptimizerService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduleOptimizerService.class);

    static final String PRIMARY_STRATEGY = "primary";

    private final ScheduleRequestValidator validator;
    private final SchedulePipeline pipeline;
    private final AlternativeScheduleGenerator alternativeGenerator;
    private final ScheduleRecommendationWriter recommendationWriter;
    private final OptimizerSettings settings;

    public ScheduleOptimizerService(ScheduleRequestValidator validator,
                                    SchedulePipeline pipeline,
                                    AlternativeScheduleGenerator alternativeGenerator,
                                    ScheduleRecommendationWriter recommendationWriter,
                                    OptimizerSettings settings) {
        this.validator = validator;
        this.pipeline = pipeline;
        this.alternativeGenerator = alternativeGenerator;
        this.recommendationWriter = recommendationWriter;
        this.settings = settings;
    }

    public ScheduleOptimization optimize(String studentId, List<Course> courses, ScheduleConstraints constraints) {
        return optimize(new OptimizationRequest(studentId, courses, constraints, null));
    }

    public ScheduleOptimization optimize(OptimizationRequest request) {
        List<ValidationError> errors = validator.validate(request);
        if (!errors.isEmpty()) {
            throw new InvalidScheduleRequestException(errors);
        }

        String studentId = request.studentId();
        ScheduleConstraints constraints = request.constraints() == null ? ScheduleConstraints.none() : request.constraints();
        int alternatives = request.alternatives() == null ? settings.getAlternatives() : request.alternatives();
        logger.info("Optimizing schedule for student {}: {} candidate courses, {} alternative(s)",
                studentId, request.courses().size(), alternatives);

        OptimizedSchedule primary = pipeline.run(studentId, PRIMARY_STRATEGY, request.courses(), constraints);
        List<OptimizedSchedule> alternativeSchedules = alternativeGenerator.generate(studentId, request.courses(), constraints, alternatives);
        List<String> recommendations = recommendationWriter.write(primary, alternativeSchedules, constraints);

        logger.info("Schedule for student {} ready: {} course(s) scheduled, {} dropped, {} conflict(s), balance score {}",
                studentId, primary.courses().size(), primary.unscheduledCourses().size(),
                primary.conflicts().size(), primary.balanceScore());
        return new ScheduleOptimization(studentId, primary, alternativeSchedules, primary.balanceScore(), recommendations);
    }
}

package com.campus.timetable.config;

import com.campus.timetable.domain.DomainModels.Course;
import com.campus.timetable.optimizer.CourseOrderings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Comparator;

@Configuration
public class OptimizerConfig {
    @Bean
    public Comparator<Course> courseOrder(OptimizerSettings settings) {
        return CourseOrderings.forName(settings.getOrdering());
    }
}

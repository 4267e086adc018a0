package com.campus.timetable;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ScheduleOptimizationControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @Test
    void optimizesScheduleFromJson() throws Exception {
        String body = """
                {
                  "studentId": "st-json",
                  "courses": [
                    {
                      "id": "CS101",
                      "title": "Intro to Programming",
                      "credits": 3,
                      "difficulty": "beginner",
                      "sections": [
                        {"id": "CS101-A", "professor": "Dr. Ash", "format": "in-person", "seatsAvailable": 25,
                         "timeSlots": [{"day": "Monday", "startTime": "09:00", "endTime": "10:30"}]},
                        {"id": "CS101-B", "professor": "Dr. Birch", "format": "hybrid", "seatsAvailable": 25,
                         "timeSlots": [{"day": "Tuesday", "startTime": "09:00", "endTime": "10:30"}]}
                      ]
                    },
                    {
                      "id": "MA201",
                      "title": "Linear Algebra",
                      "credits": 4,
                      "difficulty": "advanced",
                      "sections": [
                        {"id": "MA201-A", "professor": "Dr. Cedar", "format": "online", "seatsAvailable": 5,
                         "timeSlots": [{"day": "wednesday", "startTime": "13:00", "endTime": "14:30"}]}
                      ]
                    }
                  ],
                  "constraints": {"avoidProfessors": ["Dr. Grey"], "availableTime": 40}
                }
                """;

        mockMvc.perform(post("/api/schedules/optimize").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.studentId").value("st-json"))
                .andExpect(jsonPath("$.primary.courses.length()").value(2))
                .andExpect(jsonPath("$.primary.courses[0].section.id").value("CS101-B"))
                .andExpect(jsonPath("$.primary.courses[0].section.format").value("hybrid"))
                .andExpect(jsonPath("$.primary.totalCredits").value(7))
                .andExpect(jsonPath("$.alternatives.length()").value(2))
                .andExpect(jsonPath("$.balanceScore").isNumber())
                .andExpect(jsonPath("$.recommendations").isArray());
    }

    @Test
    void rejectsMalformedTimesWithStructuredErrors() throws Exception {
        String body = """
                {
                  "studentId": "st-bad",
                  "courses": [
                    {"id": "X", "title": "Broken", "credits": 3, "difficulty": "beginner",
                     "sections": [{"id": "X-A", "professor": "Dr. Ash", "format": "online", "seatsAvailable": 5,
                                   "timeSlots": [{"day": "Monday", "startTime": "9:75", "endTime": "10:00"}]}]}
                  ]
                }
                """;

        mockMvc.perform(post("/api/schedules/optimize").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[*].code", hasItem("INVALID_TIME")))
                .andExpect(jsonPath("$.errors[0].field").value("courses[0].sections[0].timeSlots[0].startTime"));
    }

    @Test
    void rejectsEmptyCourseList() throws Exception {
        mockMvc.perform(post("/api/schedules/optimize").contentType(MediaType.APPLICATION_JSON).content("{\"studentId\":\"s\",\"courses\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].code").value("EMPTY_COURSES"));
    }

    @Test
    void answersWrongMethodWithMethodNotAllowed() throws Exception {
        mockMvc.perform(get("/api/schedules/optimize"))
                .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void answersWrongContentTypeWithUnsupportedMediaType() throws Exception {
        mockMvc.perform(post("/api/schedules/optimize").contentType(MediaType.TEXT_PLAIN).content("courses"))
                .andExpect(status().isUnsupportedMediaType());
    }

    @Test
    void answersUnknownPathWithNotFound() throws Exception {
        mockMvc.perform(get("/api/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void rejectsUnreadableJson() throws Exception {
        mockMvc.perform(post("/api/schedules/optimize").contentType(MediaType.APPLICATION_JSON).content("{\"courses\": ["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    void reportsHealth() throws Exception {
        mockMvc.perform(get("/api/schedules/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }
}

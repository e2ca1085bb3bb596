package com.example.barshift.schedule;

import com.example.barshift.common.ApiResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/schedule")
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private final ScheduleGenerator scheduleGenerator;

    public ScheduleController(ScheduleGenerator scheduleGenerator) {
        this.scheduleGenerator = scheduleGenerator;
    }

    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<WeeklySchedule>> generate(@Valid @RequestBody ScheduleRequest request) {
        logger.debug("Schedule request for {} with {} employees", request.weekStart(), request.employees().size());

        WeeklySchedule schedule = scheduleGenerator.generate(request);
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("weekStart", schedule.weekStart());
        meta.put("assignments", schedule.assignments().size());
        meta.put("conflicts", schedule.conflicts().size());
        meta.put("warnings", schedule.warnings().size());
        return ResponseEntity.ok(ApiResponse.success("Schedule generated", schedule, meta));
    }
}

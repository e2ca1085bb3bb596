package com.example.barshift.staffing;

import com.example.barshift.common.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/staffing")
public class StaffingController {

    private final StaffingValidator staffingValidator;

    public StaffingController(StaffingValidator staffingValidator) {
        this.staffingValidator = staffingValidator;
    }

    @PostMapping("/validate")
    public ResponseEntity<ApiResponse<List<StaffingIssue>>> validate(@Valid @RequestBody StaffingValidationRequest request) {
        List<StaffingIssue> issues = staffingValidator.validate(request.staffingNeeds(), request.openTimes());
        String message = issues.isEmpty() ? "Staffing looks good" : issues.size() + " staffing issue(s) found";
        return ResponseEntity.ok(ApiResponse.success(message, issues, Map.of("issues", issues.size())));
    }
}

package com.church.chms.controller;

import com.church.chms.dto.CommonResponse;
import com.church.chms.dto.ContributionFilter;
import com.church.chms.dto.ContributionRequest;
import com.church.chms.dto.ContributionTotal;
import com.church.chms.dto.ContributionUpdateRequest;
import com.church.chms.dto.ContributionView;
import com.church.chms.dto.CreatedId;
import com.church.chms.orm.PageResult;
import com.church.chms.security.RequiresPermission;
import com.church.chms.service.ContributionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api/contributions")
public class ContributionController {

    private final ContributionService contributionService;

    public ContributionController(ContributionService contributionService) {
        this.contributionService = contributionService;
    }

    @PostMapping
    @RequiresPermission("create_contribution")
    public ResponseEntity<CommonResponse<CreatedId>> create(@Valid @RequestBody ContributionRequest request) {
        Long contributionId = contributionService.create(request);
        return ResponseEntity.ok(CommonResponse.success("Contribution recorded", new CreatedId(contributionId)));
    }

    @PutMapping("/{contribution_id}")
    @RequiresPermission("edit_contribution")
    public ResponseEntity<CommonResponse<Void>> update(@PathVariable("contribution_id") Long contributionId,
                                                       @Valid @RequestBody ContributionUpdateRequest request) {
        contributionService.update(contributionId, request);
        return ResponseEntity.ok(CommonResponse.success("Contribution updated", null));
    }

    @DeleteMapping("/{contribution_id}")
    @RequiresPermission("delete_contribution")
    public ResponseEntity<CommonResponse<Void>> delete(@PathVariable("contribution_id") Long contributionId) {
        contributionService.delete(contributionId);
        return ResponseEntity.ok(CommonResponse.success("Contribution deleted", null));
    }

    @PostMapping("/{contribution_id}/restore")
    @RequiresPermission("delete_contribution")
    public ResponseEntity<CommonResponse<Void>> restore(@PathVariable("contribution_id") Long contributionId) {
        contributionService.restore(contributionId);
        return ResponseEntity.ok(CommonResponse.success("Contribution restored", null));
    }

    @GetMapping("/{contribution_id}")
    @RequiresPermission("view_contribution")
    public ResponseEntity<CommonResponse<ContributionView>> get(@PathVariable("contribution_id") Long contributionId) {
        return ResponseEntity.ok(CommonResponse.success(contributionService.get(contributionId)));
    }

    @GetMapping
    @RequiresPermission("view_contribution")
    public ResponseEntity<CommonResponse<PageResult<ContributionView>>> getAll(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            ContributionFilter filter) {
        return ResponseEntity.ok(CommonResponse.success(contributionService.getAll(page, limit, filter)));
    }

    @GetMapping("/total")
    @RequiresPermission("view_contribution")
    public ResponseEntity<CommonResponse<ContributionTotal>> getTotal(ContributionFilter filter) {
        return ResponseEntity.ok(CommonResponse.success(contributionService.getTotal(filter)));
    }
}

package com.church.chms.controller;

import com.church.chms.dto.CommonResponse;
import com.church.chms.dto.CreatedId;
import com.church.chms.dto.FiscalYearRequest;
import com.church.chms.dto.FiscalYearView;
import com.church.chms.orm.PageResult;
import com.church.chms.security.RequiresPermission;
import com.church.chms.service.FiscalYearService;
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
@RequestMapping("/api/fiscal-years")
public class FiscalYearController {

    private final FiscalYearService fiscalYearService;

    public FiscalYearController(FiscalYearService fiscalYearService) {
        this.fiscalYearService = fiscalYearService;
    }

    @PostMapping
    @RequiresPermission("manage_fiscal_year")
    public ResponseEntity<CommonResponse<CreatedId>> create(@Valid @RequestBody FiscalYearRequest request) {
        Long fiscalYearId = fiscalYearService.create(request);
        return ResponseEntity.ok(CommonResponse.success("Fiscal year created", new CreatedId(fiscalYearId)));
    }

    @PutMapping("/{fiscal_year_id}")
    @RequiresPermission("manage_fiscal_year")
    public ResponseEntity<CommonResponse<Void>> update(@PathVariable("fiscal_year_id") Long fiscalYearId,
                                                       @Valid @RequestBody FiscalYearRequest request) {
        fiscalYearService.update(fiscalYearId, request);
        return ResponseEntity.ok(CommonResponse.success("Fiscal year updated", null));
    }

    @DeleteMapping("/{fiscal_year_id}")
    @RequiresPermission("manage_fiscal_year")
    public ResponseEntity<CommonResponse<Void>> delete(@PathVariable("fiscal_year_id") Long fiscalYearId) {
        fiscalYearService.delete(fiscalYearId);
        return ResponseEntity.ok(CommonResponse.success("Fiscal year deleted", null));
    }

    @PostMapping("/{fiscal_year_id}/close")
    @RequiresPermission("manage_fiscal_year")
    public ResponseEntity<CommonResponse<Void>> close(@PathVariable("fiscal_year_id") Long fiscalYearId) {
        fiscalYearService.close(fiscalYearId);
        return ResponseEntity.ok(CommonResponse.success("Fiscal year closed", null));
    }

    @GetMapping("/{fiscal_year_id}")
    @RequiresPermission("view_fiscal_year")
    public ResponseEntity<CommonResponse<FiscalYearView>> get(@PathVariable("fiscal_year_id") Long fiscalYearId) {
        return ResponseEntity.ok(CommonResponse.success(fiscalYearService.get(fiscalYearId)));
    }

    @GetMapping
    @RequiresPermission("view_fiscal_year")
    public ResponseEntity<CommonResponse<PageResult<FiscalYearView>>> getAll(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            @RequestParam(required = false) Long branchId,
            @RequestParam(required = false) String status) {
        return ResponseEntity.ok(CommonResponse.success(fiscalYearService.getAll(page, limit, branchId, status)));
    }
}

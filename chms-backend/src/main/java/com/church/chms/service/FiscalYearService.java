package com.church.chms.service;

import com.church.chms.dto.FiscalYearRequest;
import com.church.chms.dto.FiscalYearView;
import com.church.chms.orm.PageResult;

public interface FiscalYearService {

    Long create(FiscalYearRequest request);

    /**
     * 状态为空时保持原状态；修改后的 Active 财年不能与同分支其他 Active 财年重叠
     */
    void update(Long fiscalYearId, FiscalYearRequest request);

    /**
     * 已有预算、奉献或支出引用的财年不能删除
     */
    void delete(Long fiscalYearId);

    void close(Long fiscalYearId);

    FiscalYearView get(Long fiscalYearId);

    PageResult<FiscalYearView> getAll(int page, int limit, Long branchId, String status);
}

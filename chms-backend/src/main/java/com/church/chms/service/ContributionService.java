package com.church.chms.service;

import com.church.chms.dto.ContributionFilter;
import com.church.chms.dto.ContributionRequest;
import com.church.chms.dto.ContributionTotal;
import com.church.chms.dto.ContributionUpdateRequest;
import com.church.chms.dto.ContributionView;
import com.church.chms.orm.PageResult;

public interface ContributionService {

    Long create(ContributionRequest request);

    void update(Long contributionId, ContributionUpdateRequest request);

    void delete(Long contributionId);

    void restore(Long contributionId);

    ContributionView get(Long contributionId);

    PageResult<ContributionView> getAll(int page, int limit, ContributionFilter filter);

    /**
     * 满足条件、未删除的奉献合计
     */
    ContributionTotal getTotal(ContributionFilter filter);
}

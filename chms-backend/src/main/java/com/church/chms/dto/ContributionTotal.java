package com.church.chms.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 奉献合计，total 保留两位小数 (如 "1250.00")
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContributionTotal {

    private String total;
}

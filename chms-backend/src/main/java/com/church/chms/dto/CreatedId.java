package com.church.chms.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 创建类操作的返回值
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreatedId {

    private Long id;
}

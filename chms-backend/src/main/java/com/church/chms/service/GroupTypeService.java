package com.church.chms.service;

import com.church.chms.entity.GroupType;
import com.church.chms.orm.PageResult;

public interface GroupTypeService {

    Long create(String typeName);

    void update(Long typeId, String typeName);

    /**
     * 仍有小组使用的类型不能删除
     */
    void delete(Long typeId);

    GroupType get(Long typeId);

    PageResult<GroupType> getAll(int page, int limit, String name);
}

package com.church.chms.service;

import com.church.chms.dto.MemberRegistrationRequest;
import com.church.chms.dto.MemberUpdateRequest;
import com.church.chms.dto.MemberView;
import com.church.chms.dto.PhoneRequest;
import com.church.chms.entity.MemberPhone;
import com.church.chms.orm.PageResult;

import java.util.List;

public interface MemberService {

    /**
     * 注册成员：资料、电话、登录凭据、默认角色在同一事务内写入
     *
     * @return 新成员 mbr_id
     */
    Long register(MemberRegistrationRequest request);

    void update(Long memberId, MemberUpdateRequest request);

    // 软删除
    void delete(Long memberId);

    MemberView get(Long memberId);

    PageResult<MemberView> getAll(int page, int limit);

    Long addPhone(Long memberId, PhoneRequest request);

    void updatePhone(Long phoneId, PhoneRequest request);

    void deletePhone(Long phoneId);

    List<MemberPhone> getPhones(Long memberId);
}

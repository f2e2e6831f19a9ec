package com.church.chms.service;

import com.church.chms.entity.GroupType;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.ResourceNotFoundException;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.PageResult;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.ChurchGroupRepository;
import com.church.chms.repository.GroupTypeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@Transactional(readOnly = true)
public class GroupTypeServiceImpl implements GroupTypeService {

    private final GroupTypeRepository typeRepository;
    private final ChurchGroupRepository groupRepository;
    private final OrmTemplate orm;

    public GroupTypeServiceImpl(GroupTypeRepository typeRepository,
                                ChurchGroupRepository groupRepository,
                                OrmTemplate orm) {
        this.typeRepository = typeRepository;
        this.groupRepository = groupRepository;
        this.orm = orm;
    }

    @Override
    @Transactional
    public Long create(String typeName) {
        String name = typeName.trim();
        if (typeRepository.existsByTypeName(name)) {
            throw new BadRequestException("Group type name already exists");
        }
        Long id = typeRepository.save(new GroupType(null, name)).getGroupTypeId();
        log.info("小组类型创建成功: typeId={}, name={}", id, name);
        return id;
    }

    @Override
    @Transactional
    public void update(Long typeId, String typeName) {
        GroupType type = findType(typeId);
        String name = typeName.trim();
        if (typeRepository.existsByTypeNameAndGroupTypeIdNot(name, typeId)) {
            throw new BadRequestException("Group type name already exists");
        }
        type.setTypeName(name);
        typeRepository.save(type);
    }

    @Override
    @Transactional
    public void delete(Long typeId) {
        GroupType type = findType(typeId);
        if (groupRepository.existsByGroupTypeId(typeId)) {
            throw new BadRequestException("Cannot delete group type used by existing groups");
        }
        typeRepository.delete(type);
        log.info("小组类型已删除: {}", type.getTypeName());
    }

    @Override
    public GroupType get(Long typeId) {
        return findType(typeId);
    }

    @Override
    public PageResult<GroupType> getAll(int page, int limit, String name) {
        QueryBuilder query = QueryBuilder.from("grouptype", "gt")
                .select("gt.group_type_id", "gt.type_name")
                .whereIfPresent("gt.type_name", "LIKE", name == null ? null : "%" + name.trim() + "%")
                .orderBy("gt.type_name");
        return orm.paginate(query, page, limit, GroupType.class);
    }

    private GroupType findType(Long typeId) {
        return typeRepository.findById(typeId)
                .orElseThrow(() -> new ResourceNotFoundException("Group type not found"));
    }
}

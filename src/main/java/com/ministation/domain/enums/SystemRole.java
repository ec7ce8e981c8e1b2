package com.ministation.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 四个系统角色（对应 t_station_member.system_role，库里存 slug）。
 *
 * <p>能力集与优先级固定，不可修改、不可删除：</p>
 * <ul>
 *   <li>captain = 100，全部 8 项能力</li>
 *   <li>co-captain = 90，除 roles 外全部</li>
 *   <li>moderator = 50，view / post / pin / delete</li>
 *   <li>crew = 10，view / post；新成员默认角色</li>
 * </ul>
 */
@Getter
public enum SystemRole {

    CAPTAIN("captain", "Captain", "#FFD700", 100, false,
            EnumSet.allOf(Capability.class)),

    CO_CAPTAIN("co-captain", "Co-Captain", "#C0C0C0", 90, false,
            EnumSet.complementOf(EnumSet.of(Capability.ROLES))),

    MODERATOR("moderator", "Moderator", "#4CAF50", 50, false,
            EnumSet.of(Capability.VIEW, Capability.POST, Capability.PIN, Capability.DELETE)),

    CREW("crew", "Crew", "#2196F3", 10, true,
            EnumSet.of(Capability.VIEW, Capability.POST));

    /** 自定义角色优先级必须严格小于它。 */
    public static final int OWNER_PRIORITY = 100;

    @EnumValue
    @JsonValue
    private final String slug;

    private final String displayName;

    private final String colorHint;

    private final int priority;

    private final boolean defaultRole;

    private final Set<Capability> capabilities;

    SystemRole(String slug, String displayName, String colorHint, int priority, boolean defaultRole, Set<Capability> capabilities) {
        this.slug = slug;
        this.displayName = displayName;
        this.colorHint = colorHint;
        this.priority = priority;
        this.defaultRole = defaultRole;
        this.capabilities = Collections.unmodifiableSet(capabilities);
    }

    public boolean has(Capability capability) {
        return capability != null && capabilities.contains(capability);
    }

    public static SystemRole fromSlug(String slug) {
        if (slug == null) {
            return null;
        }
        for (SystemRole r : values()) {
            if (r.slug.equals(slug)) {
                return r;
            }
        }
        return null;
    }
}

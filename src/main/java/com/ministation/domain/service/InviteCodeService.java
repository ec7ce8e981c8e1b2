package com.ministation.domain.service;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.ministation.domain.config.StationProperties;
import com.ministation.domain.entity.StationInviteEntity;
import com.ministation.domain.mapper.StationInviteMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;

@Service
@RequiredArgsConstructor
public class InviteCodeService {

    /** 去掉了易混淆的 I / O / i / l / o / 0 / 1。 */
    static final char[] ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZabcdefghjkmnpqrstuvwxyz23456789".toCharArray();
    private static final int MAX_TRIES = 30;

    private final StationInviteMapper inviteMapper;
    private final StationProperties props;

    private final SecureRandom random = new SecureRandom();

    public String newUniqueInviteCode() {
        int len = Math.max(6, Math.min(16, props.getInviteCodeLength()));
        for (int i = 0; i < MAX_TRIES; i++) {
            String code = randomCode(len);
            long cnt = inviteMapper.selectCount(new LambdaQueryWrapper<StationInviteEntity>()
                    .eq(StationInviteEntity::getInviteCode, code));
            if (cnt == 0) {
                return code;
            }
        }
        throw new IllegalStateException("invite_code_generation_failed");
    }

    String randomCode(int len) {
        StringBuilder sb = new StringBuilder(len);
        for (int i = 0; i < len; i++) {
            sb.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return sb.toString();
    }
}

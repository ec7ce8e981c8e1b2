package com.ministation.domain.service;

import com.baomidou.mybatisplus.core.conditions.Wrapper;
import com.ministation.domain.config.StationProperties;
import com.ministation.domain.entity.StationInviteEntity;
import com.ministation.domain.mapper.StationInviteMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InviteCodeServiceTest {

    @SuppressWarnings("unchecked")
    private static Wrapper<StationInviteEntity> anyWrapper() {
        return any(Wrapper.class);
    }

    @Test
    void newUniqueInviteCode_ShouldUseConfiguredLengthAndAlphabet() {
        StationInviteMapper mapper = mock(StationInviteMapper.class);
        when(mapper.selectCount(anyWrapper())).thenReturn(0L);
        InviteCodeService svc = new InviteCodeService(mapper, new StationProperties());

        String code = svc.newUniqueInviteCode();

        assertThat(code).hasSize(8);
        String alphabet = new String(InviteCodeService.ALPHABET);
        for (char c : code.toCharArray()) {
            assertThat(alphabet.indexOf(c)).isGreaterThanOrEqualTo(0);
        }
    }

    @Test
    void alphabet_ShouldExcludeAmbiguousCharacters() {
        String alphabet = new String(InviteCodeService.ALPHABET);
        assertThat(alphabet).doesNotContain("I", "O", "i", "l", "o", "0", "1");
    }

    @Test
    void newUniqueInviteCode_ShouldRetryOnCollision() {
        StationInviteMapper mapper = mock(StationInviteMapper.class);
        when(mapper.selectCount(anyWrapper())).thenReturn(1L, 1L, 0L);
        InviteCodeService svc = new InviteCodeService(mapper, new StationProperties());

        assertThat(svc.newUniqueInviteCode()).isNotBlank();
        verify(mapper, times(3)).selectCount(anyWrapper());
    }

    @Test
    void newUniqueInviteCode_ShouldGiveUpAfterMaxTries() {
        StationInviteMapper mapper = mock(StationInviteMapper.class);
        when(mapper.selectCount(anyWrapper())).thenReturn(1L);
        InviteCodeService svc = new InviteCodeService(mapper, new StationProperties());

        assertThatThrownBy(svc::newUniqueInviteCode)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("invite_code_generation_failed");
    }

    @Test
    void newUniqueInviteCode_ShouldClampLength() {
        StationInviteMapper mapper = mock(StationInviteMapper.class);
        when(mapper.selectCount(anyWrapper())).thenReturn(0L);
        StationProperties props = new StationProperties();
        props.setInviteCodeLength(64);

        assertThat(new InviteCodeService(mapper, props).newUniqueInviteCode()).hasSize(16);
    }
}

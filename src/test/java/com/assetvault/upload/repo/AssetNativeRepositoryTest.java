package com.assetvault.upload.repo;

import com.assetvault.upload.entity.Asset;
import com.assetvault.upload.entity.AssetType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AssetNativeRepository")
class AssetNativeRepositoryTest {

    @Mock
    private NamedParameterJdbcTemplate jdbcTemplate;

    @Mock
    private AssetRepository assetRepository;

    private AssetNativeRepository repository;
    private Asset candidate;

    @BeforeEach
    void setUp() {
        repository = new AssetNativeRepository(jdbcTemplate, assetRepository);
        candidate = new Asset();
        candidate.setId(UUID.randomUUID());
        candidate.setTenantId(UUID.randomUUID());
        candidate.setUploadSessionId(UUID.randomUUID());
        candidate.setSizeBytes(2048);
        candidate.setType(AssetType.IMAGE);
        candidate.setCreatedAt(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    @DisplayName("should report the candidate as created when the row is written")
    void shouldCreate() {
        when(jdbcTemplate.update(anyString(), any(SqlParameterSource.class))).thenReturn(1);

        AssetInsertResult result = repository.insertIfAbsent(candidate);

        assertThat(result).isInstanceOf(AssetInsertResult.Created.class);
        assertThat(result.asset()).isSameAs(candidate);
        verifyNoInteractions(assetRepository);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(jdbcTemplate).update(sql.capture(), params.capture());
        assertThat(sql.getValue()).contains("ON CONFLICT (upload_session_id) WHERE deleted_at IS NULL DO NOTHING");
        assertThat(params.getValue().getValue("uploadSessionId")).isEqualTo(candidate.getUploadSessionId());
        assertThat(params.getValue().getValue("type")).isEqualTo("IMAGE");
    }

    @Test
    @DisplayName("should return the existing row when another completion inserted first")
    void shouldReturnWinner() {
        Asset winner = new Asset();
        winner.setId(UUID.randomUUID());
        winner.setUploadSessionId(candidate.getUploadSessionId());
        when(jdbcTemplate.update(anyString(), any(SqlParameterSource.class))).thenReturn(0);
        when(assetRepository.findByUploadSessionIdAndDeletedAtIsNull(candidate.getUploadSessionId()))
                .thenReturn(Optional.of(winner));

        AssetInsertResult result = repository.insertIfAbsent(candidate);

        assertThat(result).isInstanceOf(AssetInsertResult.AlreadyExists.class);
        assertThat(result.asset()).isSameAs(winner);
    }

    @Test
    @DisplayName("should fail loudly when the insert conflicted but no live row is visible")
    void shouldFailWithoutWinner() {
        when(jdbcTemplate.update(anyString(), any(SqlParameterSource.class))).thenReturn(0);
        when(assetRepository.findByUploadSessionIdAndDeletedAtIsNull(candidate.getUploadSessionId()))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> repository.insertIfAbsent(candidate))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(candidate.getUploadSessionId().toString());
    }
}

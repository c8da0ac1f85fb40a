package com.chatflow.chatflow_backend.repository;

import com.chatflow.chatflow_backend.model.conversation.RunState;
import com.chatflow.chatflow_backend.model.domain.ConversationStateEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ConversationStateRepository extends JpaRepository<ConversationStateEntity, UUID> {

    Optional<ConversationStateEntity> findByContactAddressAndFlowId(String contactAddress, UUID flowId);

    // Row lock held until the saving transaction commits
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from ConversationStateEntity c where c.contactAddress = :contactAddress and c.flowId = :flowId")
    Optional<ConversationStateEntity> lockByKey(@Param("contactAddress") String contactAddress,
                                                @Param("flowId") UUID flowId);

    @Query("select distinct c.tenantId from ConversationStateEntity c "
            + "where c.windowOpen = true and c.windowExpiresAt <= :now")
    List<String> findTenantsWithExpiredOpenWindows(@Param("now") Instant now);

    @Query("select c from ConversationStateEntity c where c.tenantId = :tenantId "
            + "and c.windowOpen = true and c.windowExpiresAt <= :now order by c.windowExpiresAt")
    List<ConversationStateEntity> findExpiredOpenWindows(@Param("tenantId") String tenantId,
                                                         @Param("now") Instant now,
                                                         Pageable page);

    // Window sub-fields only; flow position and stateVersion are untouched
    @Modifying
    @Query("update ConversationStateEntity c set c.windowOpen = false, c.windowClosedAt = :now "
            + "where c.contactAddress = :contactAddress and c.flowId = :flowId "
            + "and c.windowOpen = true and c.windowExpiresAt <= :now")
    int closeExpiredWindow(@Param("contactAddress") String contactAddress,
                           @Param("flowId") UUID flowId,
                           @Param("now") Instant now);

    @Query("select c from ConversationStateEntity c where c.runState in :states "
            + "and c.sessionExpiresAt <= :now order by c.sessionExpiresAt")
    List<ConversationStateEntity> findIdle(@Param("states") Collection<RunState> states,
                                           @Param("now") Instant now,
                                           Pageable page);

    @Modifying
    @Query("delete from ConversationStateEntity c where c.runState in :states and c.sessionExpiresAt < :cutoff")
    int deleteByRunStateInAndSessionExpiresAtBefore(@Param("states") Collection<RunState> states,
                                                    @Param("cutoff") Instant cutoff);
}

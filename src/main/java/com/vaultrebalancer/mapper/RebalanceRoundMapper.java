package com.vaultrebalancer.mapper;

import com.vaultrebalancer.domain.enums.TransferStatus;
import com.vaultrebalancer.domain.model.RebalanceRoundResult;
import com.vaultrebalancer.domain.model.TransferAction;
import com.vaultrebalancer.entity.RebalanceRoundEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between {@link RebalanceRoundResult} and {@link RebalanceRoundEntity}.
 *
 * <p>The entity keeps a few summary counters plus the whole result as JSON (via
 * {@link JsonHelper}); reading an entity back simply parses that JSON.
 */
@Mapper(imports = JsonHelper.class)
public interface RebalanceRoundMapper {

    @Mapping(target = "withdrawalsSubmitted", expression = "java(countSubmitted(result.getAllWithdrawals()))")
    @Mapping(
            target = "depositsSubmitted",
            expression = "java(result.getDeposits() != null ? result.getDeposits().getSubmitted() : 0)")
    @Mapping(target = "transferErrors", expression = "java(countErrors(result))")
    @Mapping(target = "resultJson", expression = "java(JsonHelper.toJson(result))")
    RebalanceRoundEntity toEntity(RebalanceRoundResult result);

    default RebalanceRoundResult toDomain(RebalanceRoundEntity entity) {
        if (entity == null) {
            return null;
        }
        return JsonHelper.fromJson(entity.getResultJson(), RebalanceRoundResult.class);
    }

    List<RebalanceRoundResult> toDomainList(List<RebalanceRoundEntity> entities);

    default int countSubmitted(List<TransferAction> actions) {
        return (int) actions.stream()
                .filter(a -> a.getStatus() == TransferStatus.SUBMITTED)
                .count();
    }

    default int countErrors(RebalanceRoundResult result) {
        int errors = (int) result.getAllWithdrawals().stream()
                .filter(a -> a.getStatus() == TransferStatus.ERROR)
                .count();
        return errors + (result.getDeposits() != null ? result.getDeposits().getErrors() : 0);
    }
}

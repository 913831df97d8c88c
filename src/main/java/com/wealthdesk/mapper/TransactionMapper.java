package com.wealthdesk.mapper;

import com.wealthdesk.domain.model.Transaction;
import com.wealthdesk.entity.TransactionEntity;
import java.util.List;
import org.mapstruct.Mapper;

/** MapStruct mapper between the Transaction domain model and TransactionEntity. */
@Mapper
public interface TransactionMapper {

    TransactionEntity toEntity(Transaction transaction);

    Transaction toDomain(TransactionEntity entity);

    List<Transaction> toDomainList(List<TransactionEntity> entities);
}

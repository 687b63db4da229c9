package com.ionindexer.ingestion.action.extractor;

import com.ionindexer.domain.action.Action;
import com.ionindexer.domain.action.ActionType;
import com.ionindexer.domain.action.ChangeDnsRecordData;
import com.ionindexer.domain.block.Block;
import com.ionindexer.ingestion.action.ActionExtractor;
import com.ionindexer.ingestion.action.BlockData;
import org.springframework.stereotype.Component;

import java.util.HexFormat;
import java.util.Set;

import static com.ionindexer.ingestion.action.AddressNormalizer.address;

@Component
public class DeleteDnsActionExtractor implements ActionExtractor {

    @Override
    public Set<ActionType> supportedTypes() {
        return Set.of(ActionType.DELETE_DNS);
    }

    @Override
    public void extract(Block block, String traceId, Action.ActionBuilder action) {
        BlockData data = BlockData.of(block);
        action.source(address(data.nullableAccount("source")))
                .destination(address(data.account("destination")))
                .changeDnsRecordData(ChangeDnsRecordData.deleted(HexFormat.of().formatHex(data.bytes("key"))));
    }
}

package com.ionindexer.ingestion.action.extractor;

import com.ionindexer.domain.action.Action;
import com.ionindexer.domain.action.ActionType;
import com.ionindexer.domain.block.Block;
import com.ionindexer.ingestion.action.ActionExtractor;
import com.ionindexer.ingestion.action.BlockData;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.ionindexer.ingestion.action.AddressNormalizer.address;

/**
 * Generic contract call: opcode and attached value, both ends optional.
 */
@Component
public class CallContractActionExtractor implements ActionExtractor {

    @Override
    public Set<ActionType> supportedTypes() {
        return Set.of(ActionType.CALL_CONTRACT);
    }

    @Override
    public void extract(Block block, String traceId, Action.ActionBuilder action) {
        BlockData data = BlockData.of(block);
        action.opcode(data.nullableLong("opcode"))
                .value(data.amount("value").value())
                .source(address(data.nullableAccount("source")))
                .destination(address(data.nullableAccount("destination")));
    }
}

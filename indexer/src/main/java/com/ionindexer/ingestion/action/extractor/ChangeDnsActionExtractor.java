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

/**
 * DNS record update. Which of address/flags/dns_text are read depends on the record's value schema.
 */
@Component
public class ChangeDnsActionExtractor implements ActionExtractor {

    static final String NEXT_RESOLVER = "DNSNextResolver";
    static final String SMC_ADDRESS = "DNSSmcAddress";
    static final String ADNL_ADDRESS = "DNSAdnlAddress";
    static final String TEXT = "DNSText";

    @Override
    public Set<ActionType> supportedTypes() {
        return Set.of(ActionType.CHANGE_DNS);
    }

    @Override
    public void extract(Block block, String traceId, Action.ActionBuilder action) {
        BlockData data = BlockData.of(block);
        BlockData value = data.nested("value");
        String schema = value.nullableString("schema");

        String recordAddress = null;
        Integer flags = null;
        String dnsText = null;
        if (NEXT_RESOLVER.equals(schema) || SMC_ADDRESS.equals(schema)) {
            recordAddress = address(value.account("address"));
        } else if (ADNL_ADDRESS.equals(schema)) {
            recordAddress = HexFormat.of().formatHex(value.bytes("address"));
            flags = value.nullableInt("flags");
        } else if (TEXT.equals(schema)) {
            dnsText = value.nullableString("dns_text");
        }
        if (SMC_ADDRESS.equals(schema)) {
            flags = value.nullableInt("flags");
        }

        action.source(address(data.nullableAccount("source")))
                .destination(address(data.account("destination")))
                .changeDnsRecordData(new ChangeDnsRecordData(
                        schema, flags, recordAddress, HexFormat.of().formatHex(data.bytes("key")), dnsText));
    }
}

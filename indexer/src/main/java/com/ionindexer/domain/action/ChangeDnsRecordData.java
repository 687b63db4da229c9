package com.ionindexer.domain.action;

/**
 * DNS record change. For deletions {@code valueSchema}, {@code flags} and {@code address} are null.
 * {@code address} holds an account address for DNSNextResolver/DNSSmcAddress and a hex ADNL address for DNSAdnlAddress.
 */
public record ChangeDnsRecordData(
        String valueSchema,
        Integer flags,
        String address,
        String key,
        String dnsText
) {

    public static ChangeDnsRecordData deleted(String key) {
        return new ChangeDnsRecordData(null, null, null, key, null);
    }
}

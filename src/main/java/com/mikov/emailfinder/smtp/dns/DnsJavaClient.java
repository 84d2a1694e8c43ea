package com.mikov.emailfinder.smtp.dns;

import com.mikov.emailfinder.exception.CapabilityException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * {@link DnsClient} backed by dnsjava. Timeouts are configured on the injected {@link Resolver}.
 */
@Slf4j
@RequiredArgsConstructor
public class DnsJavaClient implements DnsClient {
    private final Resolver resolver;

    @Override
    public List<MxRecord> lookupMx(final String domain) {
        final List<MxRecord> mxRecords = toMxRecords(run(domain, Type.MX));
        log.debug("Found {} MX records for {}", mxRecords.size(), domain);
        return mxRecords;
    }

    @Override
    public boolean hasNullMx(final String domain) {
        return isNullMx(run(domain, Type.MX));
    }

    static List<MxRecord> toMxRecords(final Record[] records) {
        final List<MxRecord> mxRecords = new ArrayList<>();
        for (final Record record : records) {
            if (record instanceof MXRecord) {
                final MXRecord mx = (MXRecord) record;
                if (mx.getTarget().equals(Name.root)) {
                    continue;
                }
                final String host = mx.getTarget().toString(true).toLowerCase(Locale.ROOT);
                if (!host.isEmpty()) {
                    mxRecords.add(new MxRecord(host, mx.getPriority()));
                }
            }
        }
        mxRecords.sort(Comparator.comparingInt(MxRecord::priority).thenComparing(MxRecord::hostname));
        return mxRecords;
    }

    static boolean isNullMx(final Record[] records) {
        for (final Record record : records) {
            if (record instanceof MXRecord && ((MXRecord) record).getTarget().equals(Name.root)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean hasAddress(final String domain) {
        return run(domain, Type.A).length > 0 || run(domain, Type.AAAA).length > 0;
    }

    private Record[] run(final String domain, final int type) {
        final Lookup lookup;
        try {
            lookup = new Lookup(domain, type);
        } catch (TextParseException e) {
            log.debug("Not a valid domain name: {}", domain);
            return new Record[0];
        }
        lookup.setResolver(resolver);
        final Record[] records = lookup.run();

        switch (lookup.getResult()) {
            case Lookup.SUCCESSFUL:
                return records == null ? new Record[0] : records;
            case Lookup.HOST_NOT_FOUND:
            case Lookup.TYPE_NOT_FOUND:
                return new Record[0];
            default:
                throw new CapabilityException(CapabilityException.Capability.DNS,
                        "DNS " + Type.string(type) + " lookup for " + domain + " failed: " + lookup.getErrorString());
        }
    }
}

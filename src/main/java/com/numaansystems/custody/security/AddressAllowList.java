package com.numaansystems.custody.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.web.util.matcher.IpAddressMatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Network allow-list of single addresses and CIDR blocks, IPv4 or IPv6.
 *
 * <p>Entries must be literal addresses; host names are rejected so that
 * parsing never triggers a DNS lookup. If any entry fails to parse the list
 * is marked misconfigured and denies every address, rather than silently
 * running with fewer entries than intended.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public final class AddressAllowList {

    private static final Logger logger = LoggerFactory.getLogger(AddressAllowList.class);

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9A-Fa-f:.]+$");

    private final List<IpAddressMatcher> matchers;
    private final List<String> invalidEntries;

    private AddressAllowList(List<IpAddressMatcher> matchers, List<String> invalidEntries) {
        this.matchers = matchers;
        this.invalidEntries = invalidEntries;
    }

    /**
     * Parses configured entries. Blank entries are ignored.
     *
     * @param entries addresses such as {@code 127.0.0.1}, {@code 10.0.0.0/8} or {@code fd00::/8}
     * @return the allow-list, possibly misconfigured
     */
    public static AddressAllowList parse(List<String> entries) {
        List<IpAddressMatcher> matchers = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (String raw : entries) {
            String entry = raw == null ? "" : raw.trim();
            if (entry.isEmpty()) {
                continue;
            }
            if (!isLiteral(entry)) {
                invalid.add(entry);
                continue;
            }
            try {
                matchers.add(new IpAddressMatcher(entry));
            } catch (IllegalArgumentException e) {
                logger.debug("Allow-list entry {} rejected: {}", entry, e.getMessage());
                invalid.add(entry);
            }
        }
        if (!invalid.isEmpty()) {
            logger.error("Invalid entries in custody.internal.allowed-origins: {}; all internal requests will be denied",
                    invalid);
        }
        return new AddressAllowList(Collections.unmodifiableList(matchers), Collections.unmodifiableList(invalid));
    }

    /**
     * @return true if no address restriction applies
     */
    public boolean isEmpty() {
        return matchers.isEmpty() && invalidEntries.isEmpty();
    }

    public boolean isMisconfigured() {
        return !invalidEntries.isEmpty();
    }

    public List<String> getInvalidEntries() {
        return invalidEntries;
    }

    /**
     * @param remoteAddress literal remote address of the connection
     * @return true if the address matches an entry and the list is valid
     */
    public boolean permits(String remoteAddress) {
        if (isMisconfigured() || remoteAddress == null || !isLiteralAddress(remoteAddress)) {
            return false;
        }
        for (IpAddressMatcher matcher : matchers) {
            if (matcher.matches(remoteAddress)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isLiteral(String entry) {
        int slash = entry.indexOf('/');
        String address = slash < 0 ? entry : entry.substring(0, slash);
        if (!isLiteralAddress(address)) {
            return false;
        }
        if (slash < 0) {
            return true;
        }
        String prefix = entry.substring(slash + 1);
        if (prefix.isEmpty() || prefix.length() > 3 || !prefix.chars().allMatch(Character::isDigit)) {
            return false;
        }
        int bits = Integer.parseInt(prefix);
        return bits <= (address.contains(":") ? 128 : 32);
    }

    private static boolean isLiteralAddress(String address) {
        Matcher ipv4 = IPV4.matcher(address);
        if (ipv4.matches()) {
            for (int group = 1; group <= 4; group++) {
                if (Integer.parseInt(ipv4.group(group)) > 255) {
                    return false;
                }
            }
            return true;
        }
        return address.contains(":") && IPV6.matcher(address).matches();
    }
}

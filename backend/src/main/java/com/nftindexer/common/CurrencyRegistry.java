package com.nftindexer.common;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Payment currencies accepted by the supported marketplaces on Ethereum mainnet: decimals and whether the
 * token is a USD stablecoin. Addresses are matched case-insensitively.
 */
@Component
public class CurrencyRegistry {

    /** Marker used by marketplaces for the chain's native asset (ETH). */
    public static final String NATIVE_CURRENCY = "0x0000000000000000000000000000000000000000";
    /** Alternative native-asset sentinel used by some routers. */
    public static final String NATIVE_CURRENCY_SENTINEL = "0xeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeee";
    public static final String WETH = "0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2";

    private static final Map<String, CurrencyInfo> KNOWN = Map.of(
            NATIVE_CURRENCY, new CurrencyInfo("ETH", 18, false),
            NATIVE_CURRENCY_SENTINEL, new CurrencyInfo("ETH", 18, false),
            WETH, new CurrencyInfo("WETH", 18, false),
            "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48", new CurrencyInfo("USDC", 6, true),
            "0xdac17f958d2ee523a2206206994597c13d831ec7", new CurrencyInfo("USDT", 6, true),
            "0x6b175474e89094c44da98b954eedeac495271d0f", new CurrencyInfo("DAI", 18, true),
            "0x853d955acef822db058eb8505911ed77f175b99e", new CurrencyInfo("FRAX", 18, true),
            "0x0000000000a39bb272e79075ade125fd351887ac", new CurrencyInfo("BLUR POOL", 18, false),
            "0x5283d291dbcf85356a21ba090e6db59121208b44", new CurrencyInfo("BLUR", 18, false),
            "0x95ad61b0a150d79219dcf64e1e6cc01f0b64c4ce", new CurrencyInfo("SHIB", 18, false)
    );

    public Optional<CurrencyInfo> find(String contractAddress) {
        if (contractAddress == null || contractAddress.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(KNOWN.get(contractAddress.toLowerCase().strip()));
    }

    /**
     * True for the native asset and its 1:1 wrapped form, whose amounts are already native prices.
     */
    public boolean isNativeEquivalent(String contractAddress) {
        if (contractAddress == null) {
            return false;
        }
        String key = contractAddress.toLowerCase().strip();
        return NATIVE_CURRENCY.equals(key) || NATIVE_CURRENCY_SENTINEL.equals(key) || WETH.equals(key);
    }

    public boolean isStablecoin(String contractAddress) {
        return find(contractAddress).map(CurrencyInfo::stable).orElse(false);
    }

    public record CurrencyInfo(String symbol, int decimals, boolean stable) {
    }
}

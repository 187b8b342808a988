package dev.providers.engine;

import dev.providers.model.Pricing;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Built-in prices used when a provider has none configured.
 * The chat-completion table is quoted per 1K tokens, the OpenAI table per 1M.
 */
public final class PricingTables {

    public static final String DEFAULT_KEY = "default";

    /** Chat-completion API prices, per 1K tokens, keyed by model family. */
    public static final Map<String, Pricing> API_PRICING;

    static {
        var table = new LinkedHashMap<String, Pricing>();
        table.put("deepseek", Pricing.perThousand(0.00014, 0.00028));
        table.put("mistral", Pricing.perThousand(0.002, 0.006));
        table.put(DEFAULT_KEY, Pricing.perThousand(0.001, 0.002));
        API_PRICING = Map.copyOf(table);
    }

    public static final String OPENAI_MODEL = "o3";

    /** OpenAI o3 prices, per 1M tokens. */
    public static final Pricing OPENAI_PRICING = Pricing.perMillion(10.00, 40.00);

    private PricingTables() {}

    /**
     * Look up API pricing for a model: exact key, then the longest key the model
     * name starts with ("deepseek-coder" → "deepseek"), then the default entry.
     */
    public static Pricing forModel(String model) {
        if (model == null || model.isBlank()) {
            return API_PRICING.get(DEFAULT_KEY);
        }
        String key = model.toLowerCase(Locale.ROOT);
        Pricing exact = API_PRICING.get(key);
        if (exact != null) {
            return exact;
        }
        String best = null;
        for (String family : API_PRICING.keySet()) {
            if (!DEFAULT_KEY.equals(family) && key.startsWith(family)
                && (best == null || family.length() > best.length())) {
                best = family;
            }
        }
        return API_PRICING.get(best != null ? best : DEFAULT_KEY);
    }
}

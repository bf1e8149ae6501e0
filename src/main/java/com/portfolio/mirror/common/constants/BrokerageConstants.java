package com.portfolio.mirror.common.constants;

public interface BrokerageConstants {

    String OAUTH_TOKEN_PATH = "/oauth2/token";

    String GRANT_TYPE_REFRESH = "refresh_token";

    String API_VERSION_PATH = "/v1/";

    String TIME_ENDPOINT = "time";

    String ACCOUNTS_ENDPOINT = "accounts";

    String QUOTES_ENDPOINT = "markets/quotes";

    String SYMBOLS_ENDPOINT = "symbols";

    String SYMBOL_SEARCH_ENDPOINT = "symbols/search";

    String API_KEY_HEADER = "x-api-key";

    String DEFAULT_SCHEME = "https://";
}

package com.questrail.alpaca.server;

/**
 * Transaction identifiers of one request.
 *
 * @param client echoed {@code ClientTransactionID}, 0 when absent or malformed
 * @param server assigned {@code ServerTransactionID}, 0 before assignment
 */
public record TransactionIds(int client, int server) {

    public static final TransactionIds NONE = new TransactionIds(0, 0);

    /**
     * Assigned ids when the transaction stage has run; otherwise the parsed
     * client id with server id 0.
     */
    public static TransactionIds of(AlpacaRequest request) {
        TransactionIds assigned = request.transactionIds();
        if (assigned != null) {
            return assigned;
        }
        return new TransactionIds(parseClientTransactionId(request), 0);
    }

    static int parseClientTransactionId(AlpacaRequest request) {
        String raw = request.parameter("ClientTransactionID");
        if (raw == null) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}

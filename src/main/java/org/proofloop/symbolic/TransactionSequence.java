package org.proofloop.symbolic;

import java.util.List;

public record TransactionSequence(String testClass, String testName, List<Transaction> transactions) {

    public boolean isEmpty() {
        return transactions.isEmpty();
    }
}

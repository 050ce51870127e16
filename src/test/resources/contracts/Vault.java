package fixtures;

import java.util.HashMap;
import java.util.Map;

public class Vault {

    private Map<String, Long> balances = new HashMap<>();

    public void deposit(long value) {
        long current = balances.getOrDefault(msg.sender, 0L);
        balances.put(msg.sender, current + value);
    }

    public void withdraw() {
        long amount = balances.get(msg.sender);
        require(amount > 0);
        msg.sender.call(amount);
        balances.put(msg.sender, 0L);
    }
}

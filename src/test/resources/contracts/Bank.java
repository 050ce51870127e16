package fixtures;

import java.util.HashMap;
import java.util.Map;

public class Bank extends Ledger {

    int reserve;
    Map<String, Long> accounts = new HashMap<>();
    Token token;

    public void bump(int v) {
        this.reserve = v;
        int r = reserve;
        reserve = r + 1;
        int after = this.reserve;
    }

    public long credit(String who, long v) {
        accounts.put(who, v);
        accounts.put("other", 0L);
        long seen = accounts.get(who);
        return seen;
    }

    public void pay(String who, long v) {
        token.mint(who, v);
        record(v);
        oracle.ping();
    }

    public void payout(Address to, long v) {
        to.transfer(v);
    }
}

class Ledger {

    long entries;

    void record(long v) {
        entries = entries + v;
    }
}

class Token {

    long supply;

    void mint(String who, long v) {
        supply += v;
    }
}

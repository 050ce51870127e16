package fixtures;

public class Loops {

    int total;

    public int sum(int n) {
        int s = 0;
        for (int i = 0; i < n; i++) {
            if (i == 3) {
                continue;
            }
            if (i > 10) {
                break;
            }
            s += i;
        }
        return s;
    }

    public void spin(int n) {
        int k = 0;
        do {
            k++;
        } while (k < n);
        total = k;
    }

    public void guard(int x) {
        if (x < 0) {
            revert("negative");
        }
        require(x < 100);
        total = x;
    }

    public void nested() {
        outer:
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                if (j == i) {
                    break outer;
                }
            }
        }
        total = 1;
    }

    public void chain(int v) {
        int a = v;
        int b = a + 1;
        int c = b + 1;
        int d = c + 1;
        int e = d + 1;
        total = e;
    }
}

package engine;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 里程表顺序遍历多维下标：混合进制计数器从最右位开始进位
 * 长度 (2,3) 产生 (0,0),(0,1),(0,2),(1,0),(1,1),(1,2)
 */
public class OdometerIterator implements Iterator<int[]> {

    private final int[] lengths;
    private final int[] counter;
    private boolean exhausted;

    public OdometerIterator(int[] lengths) {
        for (int length : lengths) {
            if (length <= 0) {
                throw new IllegalArgumentException("维度长度必须为正数: " + length);
            }
        }
        this.lengths = lengths.clone();
        this.counter = new int[lengths.length];
        this.exhausted = false;
    }

    @Override
    public boolean hasNext() {
        return !exhausted;
    }

    @Override
    public int[] next() {
        if (exhausted) {
            throw new NoSuchElementException();
        }
        int[] current = counter.clone();
        advance();
        return current;
    }

    private void advance() {
        for (int i = lengths.length - 1; i >= 0; i--) {
            counter[i]++;
            if (counter[i] < lengths[i]) {
                return;
            }
            counter[i] = 0;
        }
        // 最高位也已进位（或没有维度）
        exhausted = true;
    }
}

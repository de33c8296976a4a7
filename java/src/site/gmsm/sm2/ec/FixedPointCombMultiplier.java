package site.gmsm.sm2.ec;

import java.math.BigInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-point comb multiplication. A table of 2^w combinations of [2^(i*d)]P is built once
 * per base point and kept for later calls with the same point, so repeated multiplication
 * of the generator costs d doublings and d additions.
 */
public class FixedPointCombMultiplier extends AbstractECMultiplier {

    private static final Logger log = LoggerFactory.getLogger(FixedPointCombMultiplier.class);

    private final SimpleMultiplier wideScalar = new SimpleMultiplier();

    private volatile FixedPointPreCalcInfo cached;

    @Override
    protected FpPoint multiplyPositive(FpPoint p, BigInteger k) {
        FpCurve c = p.getCurve();
        int size = getCombSize(c);
        if (k.bitLength() > size) {
            // Table only spans the order's width
            return wideScalar.multiplyPositive(p, k);
        }
        FixedPointPreCalcInfo info = preCalc(p);
        int width = info.getWidth();
        int d = (size + width - 1) / width;
        FpPoint Q = c.getInfinity();
        int l = d * width;
        for (int i = 0; i < d; ++i) {
            int idx = 0;
            for (int j = l - 1 - i; j >= 0; j -= d) {
                idx <<= 1;
                if (k.testBit(j)) {
                    idx |= 1;
                }
            }
            Q = Q.twicePlus(info.lookup(idx));
        }
        return Q.add(info.getOffset());
    }

    static int getCombSize(FpCurve c) {
        BigInteger order = c.getOrder();
        return order == null ? c.getFieldSize() + 1 : order.bitLength();
    }

    private FixedPointPreCalcInfo preCalc(FpPoint p) {
        FixedPointPreCalcInfo info = cached;
        if (info != null && info.getBase().equals(p)) {
            return info;
        }
        info = buildTable(p.normalize());
        cached = info;
        return info;
    }

    private static FixedPointPreCalcInfo buildTable(FpPoint p) {
        FpCurve curve = p.getCurve();
        int bits = getCombSize(curve);
        int minWidth = bits > 250 ? 6 : 5;
        int n = 1 << minWidth;
        int d = (bits + minWidth - 1) / minWidth;
        log.debug("Precomputing comb table: width={}, entries={}, spacing={}", minWidth, n, d);

        FpPoint[] pow2Table = new FpPoint[minWidth + 1];
        pow2Table[0] = p;
        for (int i = 1; i < minWidth; ++i) {
            pow2Table[i] = pow2Table[i - 1].timesPow2(d);
        }
        // Offset cancels the extra (2^d - 1)P that every table entry carries through the loop
        pow2Table[minWidth] = pow2Table[0].subtract(pow2Table[1]);
        curve.normalizeAll(pow2Table);

        FpPoint[] lookupTable = new FpPoint[n];
        lookupTable[0] = pow2Table[0];
        for (int bit = minWidth - 1; bit >= 0; --bit) {
            FpPoint pow2 = pow2Table[bit];
            int step = 1 << bit;
            for (int i = step; i < n; i += (step << 1)) {
                lookupTable[i] = lookupTable[i - step].add(pow2);
            }
        }
        curve.normalizeAll(lookupTable);
        return new FixedPointPreCalcInfo(p, lookupTable, pow2Table[minWidth], minWidth);
    }
}

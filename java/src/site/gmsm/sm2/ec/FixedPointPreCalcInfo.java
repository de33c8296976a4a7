package site.gmsm.sm2.ec;

/** Pre-computation for the fixed-point comb multiplier, bound to one base point. */
public final class FixedPointPreCalcInfo {

    private final FpPoint base;
    private final FpPoint[] lookupTable;
    private final FpPoint offset;
    private final int width;

    FixedPointPreCalcInfo(FpPoint base, FpPoint[] lookupTable, FpPoint offset, int width) {
        this.base = base;
        this.lookupTable = lookupTable;
        this.offset = offset;
        this.width = width;
    }

    public FpPoint getBase() {
        return base;
    }

    public int getSize() {
        return lookupTable.length;
    }

    public FpPoint lookup(int index) {
        return lookupTable[index];
    }

    public FpPoint getOffset() {
        return offset;
    }

    public int getWidth() {
        return width;
    }
}

package org.lsst.fits.redshift;

/**
 * A local extremum in a sequence of values.
 */
public class Peak {

    private final int index;
    private final double value;

    public Peak(int index, double value) {
        this.index = index;
        this.value = value;
    }

    public int getIndex() {
        return index;
    }

    public double getValue() {
        return value;
    }

    @Override
    public int hashCode() {
        int hash = 5;
        hash = 29 * hash + this.index;
        hash = 29 * hash + Long.hashCode(Double.doubleToLongBits(this.value));
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Peak other = (Peak) obj;
        return this.index == other.index && Double.compare(this.value, other.value) == 0;
    }

    @Override
    public String toString() {
        return "Peak{" + "index=" + index + ", value=" + value + '}';
    }
}

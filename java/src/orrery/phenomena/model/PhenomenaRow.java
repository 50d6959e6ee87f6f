package orrery.phenomena.model;

import orrery.phenomena.PhenomenonType;

import java.io.Serializable;
import java.util.Optional;

/**
 * 某类天象在中心日期前后最近的两次
 */
public class PhenomenaRow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final PhenomenonType type;
    private final Phenomenon last;
    private final Phenomenon next;

    public PhenomenaRow(PhenomenonType type, Phenomenon last, Phenomenon next) {
        this.type = type;
        this.last = last;
        this.next = next;
    }

    public PhenomenonType getType() {
        return type;
    }

    public String getLabel() {
        return type.getLabel();
    }

    /**
     * 中心日期之前的最近一次，搜索范围内没有时为空
     */
    public Optional<Phenomenon> getLast() {
        return Optional.ofNullable(last);
    }

    /**
     * 中心日期之后的最近一次
     */
    public Optional<Phenomenon> getNext() {
        return Optional.ofNullable(next);
    }

    @Override
    public String toString() {
        return "PhenomenaRow{" +
                "type=" + type +
                ", last=" + last +
                ", next=" + next +
                '}';
    }
}

package rowset.engine.join;

import java.util.List;

/**
 * leftPrefix / rightPrefix rename the columns of a side; when no right prefix is set a right column that
 * collides with an output column gets collisionSuffix. selectColumns (empty = all) projects the
 * result to the join keys plus the listed columns. trimKeys compares key cells after trimming.
 */
public record JoinOptions(JoinType type,
                          String leftPrefix,
                          String rightPrefix,
                          String collisionSuffix,
                          boolean trimKeys,
                          List<String> selectColumns) {

    public JoinOptions {
        if (type == null) type = JoinType.INNER;
        if (leftPrefix == null) leftPrefix = "";
        if (rightPrefix == null) rightPrefix = "";
        if (collisionSuffix == null || collisionSuffix.isEmpty()) collisionSuffix = "_right";
        selectColumns = selectColumns == null ? List.of() : List.copyOf(selectColumns);
    }

    public static JoinOptions of(JoinType type) {
        return new JoinOptions(type, null, null, null, false, null);
    }

    public JoinOptions withPrefixes(String left, String right) {
        return new JoinOptions(type, left, right, collisionSuffix, trimKeys, selectColumns);
    }

    public JoinOptions withCollisionSuffix(String suffix) {
        return new JoinOptions(type, leftPrefix, rightPrefix, suffix, trimKeys, selectColumns);
    }

    public JoinOptions withTrimKeys(boolean trim) {
        return new JoinOptions(type, leftPrefix, rightPrefix, collisionSuffix, trim, selectColumns);
    }

    public JoinOptions withSelectColumns(List<String> columns) {
        return new JoinOptions(type, leftPrefix, rightPrefix, collisionSuffix, trimKeys, columns);
    }
}

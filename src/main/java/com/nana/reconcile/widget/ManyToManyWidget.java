package com.nana.reconcile.widget;

import com.nana.reconcile.store.Accessor;
import com.nana.reconcile.store.ModelStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Resolves a separated list of keys to a list of related objects with one
 * store call. Unknown keys are dropped. Renders any member collection as
 * the members' keys joined by the separator.
 *
 * <p>This widget only computes the member list; the engine writes the
 * relation after the owner has been saved.
 *
 * @param <R> related model type
 */
public class ManyToManyWidget<R> implements Widget<Collection<R>> {

    public static final String DEFAULT_SEPARATOR = ",";

    private final ModelStore<R> store;
    private final String separator;
    private final String field;
    private final Widget<Object> keyWidget;
    private final Accessor<R, Object> keyAccessor;

    @SuppressWarnings("unchecked")
    public ManyToManyWidget(ModelStore<R> store, String separator, String field, Widget<?> keyWidget) {
        this.store = store;
        this.separator = separator;
        this.field = field;
        this.keyWidget = (Widget<Object>) keyWidget;
        this.keyAccessor = store.getSchema().resolvePath(field);
    }

    public String getSeparator() { return separator; }

    public String getField() { return field; }

    public ModelStore<R> getStore() { return store; }

    @Override
    public List<R> clean(String value) {
        if (Widget.isBlank(value)) {
            return new ArrayList<>();
        }
        Set<Object> keys = new LinkedHashSet<>();
        for (String token : value.split(Pattern.quote(separator))) {
            if (!token.isBlank()) {
                Object key = keyWidget.clean(token.trim());
                if (key != null) {
                    keys.add(key);
                }
            }
        }
        if (keys.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(store.findAllIn(field, keys));
    }

    @Override
    public String render(Collection<R> members) {
        if (members == null) {
            return "";
        }
        StringJoiner joiner = new StringJoiner(separator);
        for (R member : members) {
            joiner.add(keyWidget.render(keyAccessor.get(member)));
        }
        return joiner.toString();
    }
}

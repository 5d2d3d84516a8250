package com.nana.reconcile.resource;

import com.nana.reconcile.diff.DiffEngine;
import com.nana.reconcile.diff.DiffMatchPatchEngine;
import com.nana.reconcile.store.Accessor;
import com.nana.reconcile.store.Attribute;
import com.nana.reconcile.store.ModelSchema;
import com.nana.reconcile.store.ModelStore;
import com.nana.reconcile.util.ReconcileConfig;
import com.nana.reconcile.widget.Widget;
import com.nana.reconcile.widget.WidgetFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * A {@link Resource} whose fields are generated from the store's
 * {@link ModelSchema}.
 *
 * <p>FIELD ORDER:
 * <ol>
 *   <li>Explicitly declared fields, as declared.</li>
 *   <li>Schema attributes in schema order, filtered by the {@code fields}
 *       whitelist and the {@code exclude} blacklist, unless already declared.</li>
 *   <li>Dotted relationship paths listed in {@code fields}, such as
 *       {@code author.name}. These are readonly.</li>
 * </ol>
 * Declared fields are never filtered. Generated fields get the widget
 * {@link WidgetFactory} picks for the attribute kind, configured with the
 * widget arguments registered under the field name.
 *
 * @param <T> model type
 */
public class ModelResource<T> extends Resource<T> {

    private static final Logger log = LoggerFactory.getLogger(ModelResource.class);

    public ModelResource(ModelStore<T> store, ResourceOptions options) {
        this(store, options, FieldSet.empty());
    }

    public ModelResource(ModelStore<T> store, ResourceOptions options, FieldSet<T> declared) {
        this(store, options, declared, ReconcileConfig.getInstance(), new DiffMatchPatchEngine());
    }

    public ModelResource(ModelStore<T> store, ResourceOptions options, FieldSet<T> declared,
                         ReconcileConfig config, DiffEngine diffEngine) {
        super(store, options, generateFields(store, options, declared, config), config, diffEngine);
    }

    /** @return a resource exposing every attribute of the store's model */
    public static <T> ModelResource<T> forStore(ModelStore<T> store) {
        return new ModelResource<>(store, ResourceOptions.defaults());
    }

    public static <T> ModelResource<T> forStore(ModelStore<T> store, ResourceOptions options) {
        return new ModelResource<>(store, options);
    }

    /**
     * Merges declared fields with fields generated from the schema.
     */
    static <T> FieldSet<T> generateFields(ModelStore<T> store, ResourceOptions options,
                                          FieldSet<T> declared, ReconcileConfig config) {
        ModelSchema<T> schema = store.getSchema();
        WidgetFactory widgets = new WidgetFactory(config);
        List<String> whitelist = options.getFields();
        FieldSet.Builder<T> builder = declared.toBuilder();

        for (Attribute<T, ?> attribute : schema.getAttributes()) {
            String name = attribute.getName();
            if (declared.contains(name)
                    || (whitelist != null && !whitelist.contains(name))
                    || options.getExclude().contains(name)) {
                continue;
            }
            builder.field(name, field(attribute.getAccessor(),
                    widgets.forAttribute(attribute, options.getWidgetArgs(name))));
        }

        if (whitelist != null) {
            for (String path : whitelist) {
                if (!path.contains(".") || declared.contains(path)
                        || options.getExclude().contains(path)) {
                    continue;
                }
                Attribute<?, ?> target = schema.resolveAttribute(path);
                Accessor<T, Object> accessor = schema.resolvePath(path);
                builder.field(path, field(accessor, widgets.forAttribute(target, options.getWidgetArgs(path)))
                        .attribute(path)
                        .readonly());
            }
        }

        FieldSet<T> generated = builder.build();
        log.debug("Fields for model '{}': {}", schema.getModelName(), generated);
        return generated;
    }

    @SuppressWarnings("unchecked")
    private static <T> Field<T, Object> field(Accessor<T, ?> accessor, Widget<?> widget) {
        return Field.of((Accessor<T, Object>) accessor, (Widget<Object>) widget);
    }
}

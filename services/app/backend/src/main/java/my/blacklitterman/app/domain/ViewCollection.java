package my.blacklitterman.app.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable set of views with unique ids. The row order of
 * {@link #getViewMatrix(List)} and the entry order of {@link #getViewOutPerformances()}
 * both follow insertion order.
 */
public final class ViewCollection {
	private static final ViewCollection EMPTY = new ViewCollection(new LinkedHashMap<>());

	private final Map<String, View> views;

	private ViewCollection(LinkedHashMap<String, View> views) {
		this.views = Collections.unmodifiableMap(views);
	}

	public static ViewCollection empty() {
		return EMPTY;
	}

	public static ViewCollection of(View... views) {
		return of(List.of(views));
	}

	public static ViewCollection of(List<View> views) {
		LinkedHashMap<String, View> byId = new LinkedHashMap<>();
		for (View view : views) {
			if (view == null) {
				throw new IllegalArgumentException("View must not be null");
			}
			if (byId.putIfAbsent(view.id(), view) != null) {
				throw new IllegalArgumentException("Duplicate view id " + view.id());
			}
		}
		return new ViewCollection(byId);
	}

	public List<View> getAllViews() {
		return List.copyOf(views.values());
	}

	public Optional<View> getView(String id) {
		return Optional.ofNullable(views.get(id));
	}

	public List<String> getViewIds() {
		return List.copyOf(views.keySet());
	}

	public int size() {
		return views.size();
	}

	public boolean isEmpty() {
		return views.isEmpty();
	}

	/**
	 * Returns a collection with {@code view} appended, or replacing the view with the same
	 * id in place.
	 */
	public ViewCollection with(View view) {
		if (view == null) {
			throw new IllegalArgumentException("View must not be null");
		}
		LinkedHashMap<String, View> copy = new LinkedHashMap<>(views);
		copy.put(view.id(), view);
		return new ViewCollection(copy);
	}

	public ViewCollection without(String id) {
		if (!views.containsKey(id)) {
			return this;
		}
		LinkedHashMap<String, View> copy = new LinkedHashMap<>(views);
		copy.remove(id);
		return new ViewCollection(copy);
	}

	public LabeledMatrix getViewMatrix(List<String> assetUniverse) {
		List<String> ids = new ArrayList<>(views.size());
		double[][] rows = new double[views.size()][];
		int i = 0;
		for (View view : views.values()) {
			ids.add(view.id());
			rows[i++] = view.getViewRow(assetUniverse);
		}
		return new LabeledMatrix(ids, assetUniverse, rows);
	}

	public LabeledVector getViewOutPerformances() {
		List<String> ids = new ArrayList<>(views.size());
		double[] values = new double[views.size()];
		int i = 0;
		for (View view : views.values()) {
			ids.add(view.id());
			values[i++] = view.outPerformance();
		}
		return new LabeledVector("out_performance", ids, values);
	}
}

package org.springaicommunity.github.statusreport;

import java.util.List;

/**
 * Local copy of the fetched project items, used to re-render reports without querying
 * GitHub.
 */
public interface ItemCache {

	/**
	 * Returns true if items have been stored before.
	 * @return true if {@link #read()} can be called
	 */
	boolean exists();

	/**
	 * Read the stored items.
	 * @return the items in the order they were written
	 */
	List<Item> read();

	/**
	 * Store items, replacing any previous content.
	 * @param items the items to store
	 */
	void write(List<Item> items);

}

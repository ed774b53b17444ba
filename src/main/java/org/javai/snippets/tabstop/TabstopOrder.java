package org.javai.snippets.tabstop;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * Visit order of tabstop ids: numeric ascending, the final tabstop {@code "0"}
 * last. Ids with the same numeric value ({@code "1"} and {@code "01"}) are ordered
 * shorter first.
 */
public final class TabstopOrder implements Comparator<String> {

	/**
	 * Id of the final tabstop, where the cursor ends up.
	 */
	public static final String FINAL_ID = "0";

	public static final TabstopOrder INSTANCE = new TabstopOrder();

	private TabstopOrder() {
	}

	@Override
	public int compare(String a, String b) {
		boolean aFinal = FINAL_ID.equals(a);
		boolean bFinal = FINAL_ID.equals(b);
		if (aFinal || bFinal) {
			return Boolean.compare(aFinal, bFinal);
		}
		int byValue = new BigInteger(a).compareTo(new BigInteger(b));
		if (byValue != 0) {
			return byValue;
		}
		int byLength = Integer.compare(a.length(), b.length());
		return byLength != 0 ? byLength : a.compareTo(b);
	}
}

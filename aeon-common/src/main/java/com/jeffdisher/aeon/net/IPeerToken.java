package com.jeffdisher.aeon.net;


/**
 * The opaque handle of one reliable connection.  The owner of the transport can attach its own state to it.
 */
public interface IPeerToken
{
	/**
	 * @return The data previously attached with setData() (null if nothing was attached).
	 */
	Object getData();

	/**
	 * Attaches data to this token, replacing anything attached before.
	 * 
	 * @param data The data to attach.
	 */
	void setData(Object data);
}

package org.lokray.fbs.runtime.rpc;

/**
 * A call failed in the transport or was aborted.
 */
public class RpcException extends RuntimeException
{
	public RpcException(String message)
	{
		super(message);
	}

	public RpcException(String message, Throwable cause)
	{
		super(message, cause);
	}
}

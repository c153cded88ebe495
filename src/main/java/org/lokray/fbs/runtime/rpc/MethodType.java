package org.lokray.fbs.runtime.rpc;

public enum MethodType
{
	UNARY,
	SERVER_STREAMING,
	CLIENT_STREAMING,
	BIDI_STREAMING
}

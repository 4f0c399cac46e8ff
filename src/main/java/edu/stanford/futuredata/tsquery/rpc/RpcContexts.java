package edu.stanford.futuredata.tsquery.rpc;

import io.grpc.*;
import io.grpc.stub.MetadataUtils;

/** The {@code logicNode} header naming the calling node on every task stream. */
public final class RpcContexts {

    public static final Metadata.Key<String> LOGIC_NODE_HEADER =
            Metadata.Key.of("logicnode", Metadata.ASCII_STRING_MARSHALLER);
    public static final Context.Key<String> LOGIC_NODE = Context.key("logicNode");

    private RpcContexts() {}

    public static ClientInterceptor attachLogicNode(String indicator) {
        Metadata headers = new Metadata();
        headers.put(LOGIC_NODE_HEADER, indicator);
        return MetadataUtils.newAttachHeadersInterceptor(headers);
    }

    public static ServerInterceptor logicNodeInterceptor() {
        return new ServerInterceptor() {
            @Override
            public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call, Metadata headers,
                                                                         ServerCallHandler<ReqT, RespT> next) {
                String logicNode = headers.get(LOGIC_NODE_HEADER);
                if (logicNode == null) {
                    return next.startCall(call, headers);
                }
                Context ctx = Context.current().withValue(LOGIC_NODE, logicNode);
                return Contexts.interceptCall(ctx, call, headers, next);
            }
        };
    }
}

package com.streamfirst.interchain.domain.observed;

import com.streamfirst.interchain.domain.Consolidatable;
import com.streamfirst.interchain.domain.ConsolidatedMessage;
import com.streamfirst.interchain.domain.CrosschainMessage;
import com.streamfirst.interchain.domain.CrosschainTransfer;
import com.streamfirst.interchain.domain.MessageKey;
import com.streamfirst.interchain.domain.MessageStatus;
import com.streamfirst.interchain.domain.TransferType;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bridge-agnostic accumulation of the events that make up one cross-chain message.
 *
 * <p>Observations arrive in any order and from different chains. The message becomes
 * consolidatable once the send is known and final once execution succeeded and, when a token
 * transfer accompanies the message, both of its sides were observed. Failed executions are not
 * final because most bridges allow retrying them.
 */
@Data
@NoArgsConstructor
public class ObservedMessage implements Consolidatable<ObservedMessage> {

  private SendObservation send;
  private ReceiveObservation receive;
  private ExecutionObservation execution;
  private boolean transferExpected;
  private SourceTransferObservation sourceTransfer;
  private DestinationTransferObservation destinationTransfer;

  @Override
  public Optional<ConsolidatedMessage> consolidate(MessageKey key) {
    if (send == null) {
      return Optional.empty();
    }

    CrosschainMessage message =
        CrosschainMessage.builder()
            .id(key.messageId())
            .bridgeId(key.bridgeId())
            .status(status())
            .initTimestamp(send.blockTimestamp())
            .lastUpdateTimestamp(lastUpdateTimestamp())
            .srcChainId(send.chainId())
            .dstChainId(destinationChainId())
            .nativeId(send.nativeId())
            .srcTxHash(send.txHash())
            .dstTxHash(destinationTxHash())
            .senderAddress(send.sender())
            .recipientAddress(send.recipient())
            .payload(send.payload())
            .build();

    List<CrosschainTransfer> transfers =
        sourceTransfer == null && destinationTransfer == null
            ? List.of()
            : List.of(buildTransfer(key));

    boolean executed = execution != null && execution.succeeded();
    boolean transferComplete =
        !transferExpected || (sourceTransfer != null && destinationTransfer != null);

    return Optional.of(new ConsolidatedMessage(executed && transferComplete, message, transfers));
  }

  @Override
  public ObservedMessage copy() {
    ObservedMessage copy = new ObservedMessage();
    copy.send = send;
    copy.receive = receive;
    copy.execution = execution;
    copy.transferExpected = transferExpected;
    copy.sourceTransfer = sourceTransfer;
    copy.destinationTransfer = destinationTransfer;
    return copy;
  }

  private MessageStatus status() {
    if (execution == null) {
      return MessageStatus.INITIATED;
    }
    return execution.succeeded() ? MessageStatus.COMPLETED : MessageStatus.FAILED;
  }

  private Long destinationChainId() {
    if (receive != null) {
      return receive.chainId();
    }
    if (execution != null) {
      return execution.chainId();
    }
    return null;
  }

  private String destinationTxHash() {
    if (receive != null) {
      return receive.txHash();
    }
    return execution != null ? execution.txHash() : null;
  }

  private Instant lastUpdateTimestamp() {
    Instant latest = receive != null ? receive.blockTimestamp() : null;
    if (execution != null
        && execution.blockTimestamp() != null
        && (latest == null || execution.blockTimestamp().isAfter(latest))) {
      latest = execution.blockTimestamp();
    }
    return latest;
  }

  private CrosschainTransfer buildTransfer(MessageKey key) {
    Long dstChain = destinationChainId();
    long tokenDstChainId = dstChain != null ? dstChain : send.destinationChainId();

    CrosschainTransfer.CrosschainTransferBuilder transfer =
        CrosschainTransfer.builder()
            .messageId(key.messageId())
            .bridgeId(key.bridgeId())
            .index(0)
            .tokenSrcChainId(send.chainId())
            .tokenDstChainId(tokenDstChainId)
            .type(TransferType.ERC20)
            .srcAmount(BigInteger.ZERO)
            .dstAmount(BigInteger.ZERO)
            .tokenSrcAddress("")
            .tokenDstAddress("");

    if (sourceTransfer != null) {
      transfer
          .type(sourceTransfer.type() != null ? sourceTransfer.type() : TransferType.ERC20)
          .srcAmount(sourceTransfer.amount())
          .dstAmount(sourceTransfer.amount())
          .tokenSrcAddress(nullToEmpty(sourceTransfer.tokenAddress()))
          .tokenDstAddress(nullToEmpty(sourceTransfer.destinationTokenAddress()))
          .senderAddress(sourceTransfer.sender())
          .recipientAddress(sourceTransfer.recipient());
    }

    if (destinationTransfer != null) {
      transfer.recipientAddress(destinationTransfer.recipient());
      if (destinationTransfer.amount() != null) {
        transfer.dstAmount(destinationTransfer.amount());
      }
    }

    return transfer.build();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}

package com.streamfirst.interchain.domain;

public enum TransferType {
  ERC20,
  ERC721,
  NATIVE,
  ERC1155
}

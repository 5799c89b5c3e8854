package org.ihtsdo.termserver.tx.domain;

import java.util.ArrayList;
import java.util.List;

import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;

public class CodeableConcept {

	@SerializedName("coding")
	@Expose
	private List<Coding> coding = new ArrayList<>();

	@SerializedName("text")
	@Expose
	private String text;

	public CodeableConcept() {
	}

	public CodeableConcept(List<Coding> coding) {
		this.coding = new ArrayList<>(coding);
	}

	public List<Coding> getCoding() {
		return coding;
	}

	public void setCoding(List<Coding> coding) {
		this.coding = coding;
	}

	public String getText() {
		return text;
	}

	public void setText(String text) {
		this.text = text;
	}
}
